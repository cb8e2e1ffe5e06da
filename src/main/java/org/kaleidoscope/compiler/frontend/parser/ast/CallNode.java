package org.kaleidoscope.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a function call.
 *
 * @param callee The name of the called function.
 * @param arguments The argument expressions in call order.
 */
public record CallNode(String callee, List<ExprNode> arguments) implements ExprNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
