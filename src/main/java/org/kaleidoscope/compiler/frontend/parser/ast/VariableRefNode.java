package org.kaleidoscope.compiler.frontend.parser.ast;

/**
 * An AST node that references a variable, like {@code a}.
 *
 * @param name The name of the variable.
 */
public record VariableRefNode(String name) implements ExprNode {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVariableRef(this);
    }
}
