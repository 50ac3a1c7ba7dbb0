package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * Base interface of all AST nodes. Nodes are immutable and own their children:
 * the tree has no back references and no node has two parents.
 */
public interface AstNode {

    /**
     * Returns the direct children of this node, in source order.
     * Leaf nodes return an empty list.
     * @return The child nodes.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }

    /**
     * @return The token whose position is used when reporting problems with this node.
     */
    Token location();
}
