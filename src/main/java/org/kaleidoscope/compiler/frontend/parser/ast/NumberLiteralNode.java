package org.kaleidoscope.compiler.frontend.parser.ast;

/**
 * An AST node that represents a numeric literal like {@code 1.0}.
 *
 * @param value The value of the literal.
 */
public record NumberLiteralNode(double value) implements ExprNode {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumberLiteral(this);
    }
}
