package org.localcompute.algebra.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A generic class for traversing and rewriting expression trees.
 * It only relies on {@link Expr#getChildren()} and {@link Expr#reconstructWithChildren(List)},
 * so callers never need to know the concrete node types.
 */
public class ExprWalker {

    /**
     * Walks a tree in pre-order.
     * @param node The root node.
     * @param handler The handler invoked for every node.
     */
    public void walk(Expr node, Consumer<Expr> handler) {
        if (node == null) {
            return;
        }
        handler.accept(node);
        for (Expr child : node.getChildren()) {
            walk(child, handler);
        }
    }

    /**
     * Checks whether any node in the tree satisfies a predicate.
     * @param node The root node.
     * @param predicate The predicate.
     * @return {@code true} if at least one node matches.
     */
    public boolean anyMatch(Expr node, Predicate<Expr> predicate) {
        if (node == null) {
            return false;
        }
        if (predicate.test(node)) {
            return true;
        }
        for (Expr child : node.getChildren()) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rewrites the first node, in pre-order, for which the rewriter yields a replacement.
     * Every other node is kept as is.
     *
     * @param node The root node.
     * @param rewriter Returns a replacement for a node, or empty to leave it and descend.
     * @return The rewritten tree, or empty if no node was rewritten.
     */
    public Optional<Expr> rewriteFirst(Expr node, Function<Expr, Optional<Expr>> rewriter) {
        Optional<Expr> replacement = rewriter.apply(node);
        if (replacement.isPresent()) {
            return replacement;
        }
        List<Expr> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            Optional<Expr> rewritten = rewriteFirst(children.get(i), rewriter);
            if (rewritten.isPresent()) {
                List<Expr> newChildren = new ArrayList<>(children);
                newChildren.set(i, rewritten.get());
                return Optional.of(node.reconstructWithChildren(newChildren));
            }
        }
        return Optional.empty();
    }

    /**
     * Rebuilds a tree bottom-up, applying a transformation to every node after its children.
     * @param node The root node.
     * @param transformation The transformation.
     * @return The transformed tree.
     */
    public Expr transformBottomUp(Expr node, Function<Expr, Expr> transformation) {
        List<Expr> children = node.getChildren();
        if (children.isEmpty()) {
            return transformation.apply(node);
        }
        List<Expr> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (Expr child : children) {
            Expr transformed = transformBottomUp(child, transformation);
            changed |= !transformed.equals(child);
            newChildren.add(transformed);
        }
        Expr rebuilt = changed ? node.reconstructWithChildren(newChildren) : node;
        return transformation.apply(rebuilt);
    }
}
