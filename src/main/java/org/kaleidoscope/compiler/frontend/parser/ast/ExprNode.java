package org.kaleidoscope.compiler.frontend.parser.ast;

/**
 * An expression. The set of expression kinds is closed; consumers dispatch over it with an
 * {@link ExprVisitor}, so adding a kind breaks every consumer at compile time.
 */
public sealed interface ExprNode extends AstNode
        permits NumberLiteralNode, VariableRefNode, BinaryOpNode, CallNode {

    /**
     * Dispatches to the visitor method for this node's kind.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(ExprVisitor<R> visitor);
}
