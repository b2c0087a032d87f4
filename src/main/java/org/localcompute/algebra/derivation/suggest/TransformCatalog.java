package org.localcompute.algebra.derivation.suggest;

import org.localcompute.algebra.simplify.Simplifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The priority-ordered catalogue of transformations. Rules with equal priority keep
 * their registration order.
 */
public class TransformCatalog {

    private final List<ITransformRule> rules = new ArrayList<>();

    /**
     * Registers a rule.
     * @param rule The rule.
     */
    public void register(ITransformRule rule) {
        rules.add(rule);
        rules.sort(Comparator.comparingInt(ITransformRule::priority).reversed());
    }

    /**
     * @return The rules, highest priority first.
     */
    public List<ITransformRule> rules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Initializes a catalogue with the standard rule set.
     * @return The initialized catalogue.
     */
    public static TransformCatalog initialize() {
        TransformCatalog catalog = new TransformCatalog();
        catalog.register(TransformRule.rewriting("constant_fold", "Evaluate numeric operations", 100, Rewrites::constantFold));
        catalog.register(TransformRule.suggestOnly("indeterminate_zero_power_zero", "Warning: 0^0 is indeterminate", 95,
                Simplifier::isZeroPowerZero));

        catalog.register(TransformRule.rewriting("add_zero", "Remove addition of zero (x + 0 = x)", 90, Rewrites::addZero));
        catalog.register(TransformRule.rewriting("subtract_zero", "Remove subtraction of zero (x - 0 = x)", 90, Rewrites::subtractZero));
        catalog.register(TransformRule.rewriting("multiply_one", "Remove multiplication by one (x * 1 = x)", 90, Rewrites::multiplyOne));
        catalog.register(TransformRule.rewriting("divide_one", "Remove division by one (x / 1 = x)", 90, Rewrites::divideOne));
        catalog.register(TransformRule.rewriting("multiply_zero", "Simplify multiplication by zero (x * 0 = 0)", 90, Rewrites::multiplyZero));
        catalog.register(TransformRule.rewriting("zero_dividend", "Simplify zero divided by a nonzero value (0 / x = 0)", 90, Rewrites::zeroDividend));
        catalog.register(TransformRule.rewriting("power_one", "Remove exponent of one (x^1 = x)", 90, Rewrites::powerOne));
        catalog.register(TransformRule.rewriting("power_zero", "Simplify exponent of zero (x^0 = 1, except 0^0)", 90, Rewrites::powerZero));
        catalog.register(TransformRule.rewriting("base_one", "Simplify base of one (1^x = 1, (1^a)^b = 1)", 90, Rewrites::baseOne));

        catalog.register(TransformRule.rewriting("subtract_self", "Simplify self-subtraction (x - x = 0)", 85, Rewrites::subtractSelf));
        catalog.register(TransformRule.rewriting("divide_self", "Simplify self-division (x / x = 1)", 85, Rewrites::divideSelf));
        catalog.register(TransformRule.rewriting("double_negation", "Remove double negation (--x = x)", 80, Rewrites::doubleNegation));
        catalog.register(TransformRule.rewriting("combine_like_terms", "Combine like terms (x + x = 2x, ax + bx = (a+b)x)", 70,
                Rewrites::combineLikeTerms));
        catalog.register(TransformRule.rewriting("distribute", "Apply distributive law (a(b + c) = ab + ac)", 60, Rewrites::distribute));
        catalog.register(TransformRule.suggestOnly("factor_common", "Factor out common terms (ab + ac = a(b + c))", 55,
                Rewrites::hasCommonFactor));
        catalog.register(TransformRule.rewriting("simplify_fraction", "Simplify fraction (reduce common factors)", 50,
                Rewrites::simplifyFraction));
        catalog.register(TransformRule.rewriting("power_of_power", "Simplify power of power ((x^a)^b = x^(a*b))", 45,
                Rewrites::powerOfPower));
        catalog.register(TransformRule.rewriting("multiply_powers", "Combine powers with same base (x^a * x^b = x^(a+b))", 45,
                Rewrites::multiplyPowers));
        return catalog;
    }
}
