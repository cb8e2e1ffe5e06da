package org.kaleidoscope.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node exclusively owns its children; the tree contains no shared nodes and no cycles.
 */
public sealed interface AstNode permits ExprNode, PrototypeNode, FunctionNode {
    /**
     * Returns a list of the direct child nodes.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
