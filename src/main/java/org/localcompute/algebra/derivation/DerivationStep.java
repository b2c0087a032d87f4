package org.localcompute.algebra.derivation;

/**
 * One claimed equality of a derivation, as raw text.
 *
 * @param lhs The left-hand side.
 * @param rhs The right-hand side.
 */
public record DerivationStep(String lhs, String rhs) {

    public static DerivationStep of(String lhs, String rhs) {
        return new DerivationStep(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
