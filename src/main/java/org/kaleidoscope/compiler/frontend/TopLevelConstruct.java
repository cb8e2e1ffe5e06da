package org.kaleidoscope.compiler.frontend;

import org.kaleidoscope.compiler.frontend.parser.ast.AstNode;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;

/**
 * A successfully parsed top-level construct.
 */
public sealed interface TopLevelConstruct
        permits TopLevelConstruct.Definition, TopLevelConstruct.Extern, TopLevelConstruct.TopLevelExpression {

    /**
     * @return The root node of the construct.
     */
    AstNode node();

    /**
     * A {@code def} function definition.
     * @param node The function.
     */
    record Definition(FunctionNode node) implements TopLevelConstruct {}

    /**
     * An {@code extern} declaration.
     * @param node The declared prototype.
     */
    record Extern(PrototypeNode node) implements TopLevelConstruct {}

    /**
     * A bare expression, wrapped in an anonymous function.
     * @param node The anonymous function.
     */
    record TopLevelExpression(FunctionNode node) implements TopLevelConstruct {}
}
