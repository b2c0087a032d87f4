package org.localcompute.algebra.derivation.suggest;

import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A transformation rule built from functions.
 *
 * @param tag The tag.
 * @param description The description.
 * @param priority The priority.
 * @param rewriter The node rewriter; {@code null} for suggest-only rules.
 * @param matcher The node matcher.
 */
public record TransformRule(String tag, String description, int priority,
                           Function<Expr, Optional<Expr>> rewriter, Predicate<Expr> matcher) implements ITransformRule {

    /**
     * A rule that applies wherever its rewriter yields a replacement.
     */
    public static TransformRule rewriting(String tag, String description, int priority,
                                          Function<Expr, Optional<Expr>> rewriter) {
        return new TransformRule(tag, description, priority, rewriter, node -> rewriter.apply(node).isPresent());
    }

    /**
     * A rule that is reported where it matches but never rewrites anything.
     */
    public static TransformRule suggestOnly(String tag, String description, int priority, Predicate<Expr> matcher) {
        return new TransformRule(tag, description, priority, null, matcher);
    }

    @Override
    public boolean matches(Expr node) {
        return matcher.test(node);
    }

    @Override
    public Optional<Expr> rewrite(Expr node) {
        return rewriter == null ? Optional.empty() : rewriter.apply(node);
    }

    @Override
    public boolean isSuggestOnly() {
        return rewriter == null;
    }
}
