package org.mathtutor.expression.frontend.parser.ast;

import org.mathtutor.expression.api.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the expression Abstract Syntax Tree (AST).
 * <p>
 * The set of node types is closed. Code that needs to handle every node type implements
 * {@link AstNodeVisitor}, so adding a node type fails to compile until every stage handles it.
 * Nodes are immutable and a tree never shares a node between two parents.
 */
public sealed interface AstNode permits NumberNode, VariableNode, BinaryNode, UnaryNode, PowerNode {

    /**
     * Returns the part of the source this node was parsed from.
     * Nodes created by the parser always have a span; nodes synthesized during
     * simplification may not.
     *
     * @return The source span, or {@code null} if the node has none.
     */
    SourceSpan span();

    /**
     * Creates a copy of this node covering a different part of the source.
     * @param span The new span, may be {@code null}.
     * @return A node equal to this one except for its span.
     */
    AstNode withSpan(SourceSpan span);

    /**
     * Dispatches to the visitor method for this node type.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(AstNodeVisitor<R> visitor);

    /**
     * @return {@code true} if this node carries a span.
     */
    default boolean hasSpan() {
        return span() != null;
    }

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
