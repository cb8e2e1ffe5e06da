package org.kaleidoscope.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a binary operator applied to two operands.
 *
 * @param operator The operator character, e.g. {@code '+'}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryOpNode(char operator, ExprNode left, ExprNode right) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
