package org.localcompute.algebra.derivation.suggest;

import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.Optional;

/**
 * A named algebraic transformation that can be suggested, and usually applied, at a single node.
 */
public interface ITransformRule {

    /**
     * @return The snake_case tag, e.g. {@code add_zero}.
     */
    String tag();

    /**
     * @return A human-readable description including the identity, e.g. {@code x + 0 = x}.
     */
    String description();

    /**
     * @return The priority; higher runs first.
     */
    int priority();

    /**
     * Checks whether the rule applies at a node. The node's children are not considered.
     * @param node The node.
     * @return Whether the rule applies here.
     */
    boolean matches(Expr node);

    /**
     * Rewrites a node.
     * @param node The node.
     * @return The replacement, or empty if the rule does not apply here or only suggests.
     */
    Optional<Expr> rewrite(Expr node);

    /**
     * @return Whether the rule can be reported but never applied.
     */
    default boolean isSuggestOnly() {
        return false;
    }
}
