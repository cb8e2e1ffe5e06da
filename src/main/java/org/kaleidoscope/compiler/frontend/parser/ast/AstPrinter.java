package org.kaleidoscope.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Renders AST nodes as parenthesized prefix text, e.g. {@code (+ 1 (* 2 3))}.
 */
public class AstPrinter implements ExprVisitor<String> {

    private static final String ANONYMOUS_NAME = "<anon>";

    /**
     * @param node The node to print.
     * @return The textual form of the node.
     */
    public String print(AstNode node) {
        if (node instanceof ExprNode expr) {
            return expr.accept(this);
        }
        if (node instanceof PrototypeNode prototype) {
            return printPrototype(prototype);
        }
        FunctionNode function = (FunctionNode) node;
        return "(def " + printPrototype(function.prototype()) + " " + function.body().accept(this) + ")";
    }

    /**
     * Prints an extern declaration.
     * @param prototype The declared prototype.
     * @return E.g. {@code (extern (sin x))}.
     */
    public String printExtern(PrototypeNode prototype) {
        return "(extern " + printPrototype(prototype) + ")";
    }

    @Override
    public String visitNumberLiteral(NumberLiteralNode node) {
        return formatNumber(node.value());
    }

    @Override
    public String visitVariableRef(VariableRefNode node) {
        return node.name();
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
        return parenthesize(String.valueOf(node.operator()), List.of(node.left(), node.right()));
    }

    @Override
    public String visitCall(CallNode node) {
        return parenthesize("call " + node.callee(), node.arguments());
    }

    private String printPrototype(PrototypeNode prototype) {
        StringBuilder builder = new StringBuilder();
        builder.append('(').append(prototype.isAnonymous() ? ANONYMOUS_NAME : prototype.name());
        for (String parameter : prototype.parameters()) {
            builder.append(' ').append(parameter);
        }
        return builder.append(')').toString();
    }

    private String parenthesize(String name, List<ExprNode> exprs) {
        StringBuilder builder = new StringBuilder();
        builder.append('(').append(name);
        for (ExprNode expr : exprs) {
            builder.append(' ').append(expr.accept(this));
        }
        return builder.append(')').toString();
    }

    private static String formatNumber(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
