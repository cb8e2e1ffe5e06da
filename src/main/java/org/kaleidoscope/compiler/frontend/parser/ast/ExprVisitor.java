package org.kaleidoscope.compiler.frontend.parser.ast;

/**
 * Exhaustive dispatch over the expression kinds.
 *
 * @param <R> The result type.
 */
public interface ExprVisitor<R> {
    R visitNumberLiteral(NumberLiteralNode node);

    R visitVariableRef(VariableRefNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitCall(CallNode node);
}
