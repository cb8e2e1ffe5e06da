package org.kaleidoscope.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The "prototype" of a function: its name and the names of its parameters, and thus
 * implicitly the number of arguments it takes. Parameter names are not required to be unique.
 *
 * @param name The function name. Empty for the wrapper of a top-level expression.
 * @param parameters The parameter names in declaration order.
 */
public record PrototypeNode(String name, List<String> parameters) implements AstNode {

    public PrototypeNode {
        parameters = List.copyOf(parameters);
    }

    /**
     * Creates the prototype of an anonymous top-level function.
     * @return A prototype with an empty name and no parameters.
     */
    public static PrototypeNode anonymous() {
        return new PrototypeNode("", List.of());
    }

    /**
     * @return true if this is the prototype of an anonymous top-level function.
     */
    public boolean isAnonymous() {
        return name.isEmpty();
    }
}
