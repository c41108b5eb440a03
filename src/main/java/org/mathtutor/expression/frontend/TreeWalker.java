package org.mathtutor.expression.frontend;

import org.mathtutor.expression.frontend.parser.ast.AstNode;

import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an expression tree in pre-order.
 * Instead of a full visitor, this walker uses a handler-based system so that an
 * analysis only registers for the node types it cares about.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk, may be {@code null}.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }
}
