package org.kaleidoscope.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A function definition: a prototype and the body expression.
 *
 * @param prototype The function's prototype.
 * @param body The body expression.
 */
public record FunctionNode(PrototypeNode prototype, ExprNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(prototype, body);
    }
}
