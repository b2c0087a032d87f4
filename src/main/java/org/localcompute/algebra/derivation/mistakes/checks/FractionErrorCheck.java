package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.Optional;

/**
 * Detects fractions added without a common denominator: {@code 1/2 + 1/3 = 2/5}, or a common
 * denominator {@code b*d} paired with the unscaled numerators.
 */
public class FractionErrorCheck implements IMistakeCheck {

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        if (!step.bothSidesParsed()
                || !(step.lhsTree() instanceof Expr.Binary sum && sum.op().isAdditive())
                || !(sum.left() instanceof Expr.Binary first && first.op() == Operator.DIVIDE)
                || !(sum.right() instanceof Expr.Binary second && second.op() == Operator.DIVIDE)
                || !(step.rhsTree() instanceof Expr.Binary result && result.op() == Operator.DIVIDE)) {
            return Optional.empty();
        }
        Fractions f = new Fractions(first.left(), first.right(), second.left(), second.right(),
                sum.op(), result.left(), result.right());
        if (f.isNumeric()) {
            return checkNumeric(step, f);
        }
        return checkSymbolic(step, f);
    }

    private Optional<MistakeRecord> checkNumeric(StepContext step, Fractions f) {
        long a = f.value(f.a());
        long b = f.value(f.b());
        long c = f.value(f.c());
        long d = f.value(f.d());
        long n = f.value(f.n());
        long m = f.value(f.m());
        if (b == 0 || d == 0) {
            return Optional.empty();
        }
        long sign = f.op() == Operator.ADD ? 1 : -1;
        long correctNum = a * d + sign * b * c;
        long correctDen = b * d;
        String expected = reduced(correctNum, correctDen);
        String op = f.op() == Operator.ADD ? " + " : " - ";
        String working = "(" + a + "×" + d + op + b + "×" + c + ")/(" + b + "×" + d + ") = "
                + correctNum + "/" + correctDen;
        if (!working.endsWith(" = " + expected)) {
            working += " = " + expected;
        }

        if (n == a + sign * c && m == b + d) {
            return Optional.of(step.mistake(MistakeType.FRACTION_ERROR, expected, 0.95,
                    "Fraction addition error. You cannot add fractions by adding numerators and denominators separately.",
                    a + "/" + b + op + c + "/" + d + " requires a common denominator. The correct calculation is "
                            + working + "."));
        }
        if (m == b * d && n == a + sign * c) {
            return Optional.of(step.mistake(MistakeType.FRACTION_ERROR, expected, 0.9,
                    "Fraction addition error. After moving to a common denominator, each numerator must be scaled as well.",
                    "Multiply each numerator by the other denominator: " + working + "."));
        }
        return Optional.empty();
    }

    private Optional<MistakeRecord> checkSymbolic(StepContext step, Fractions f) {
        Expr numerators = Expr.binary(f.op(), f.a(), f.c());
        Expr crossed = Expr.binary(f.op(), Expr.multiply(f.a(), f.d()), Expr.multiply(f.b(), f.c()));
        Expr commonDenominator = Expr.multiply(f.b(), f.d());
        String expected = step.format(step.simplify(Expr.divide(crossed, commonDenominator)));
        String shown = step.format(f.a()) + "/" + step.format(f.b()) + (f.op() == Operator.ADD ? " + " : " - ")
                + step.format(f.c()) + "/" + step.format(f.d());

        if (step.equivalent(f.n(), numerators) && step.equivalent(f.m(), Expr.add(f.b(), f.d()))) {
            return Optional.of(step.mistake(MistakeType.FRACTION_ERROR, expected, 0.9,
                    "Fraction addition error. You cannot add fractions by adding numerators and denominators separately.",
                    shown + " = " + expected + ", not (a + c)/(b + d)."));
        }
        if (step.equivalent(f.m(), commonDenominator) && step.equivalent(f.n(), numerators)) {
            return Optional.of(step.mistake(MistakeType.FRACTION_ERROR, expected, 0.85,
                    "Fraction addition error. After moving to a common denominator, each numerator must be scaled as well.",
                    "a/b + c/d = (a·d + b·c)/(b·d). Here: " + shown + " = " + expected + "."));
        }
        return Optional.empty();
    }

    private static String reduced(long numerator, long denominator) {
        long g = gcd(Math.abs(numerator), Math.abs(denominator));
        long n = numerator / g;
        long d = denominator / g;
        if (d < 0) {
            n = -n;
            d = -d;
        }
        return d == 1 ? Long.toString(n) : n + "/" + d;
    }

    private static long gcd(long a, long b) {
        return b == 0 ? Math.max(a, 1) : gcd(b, a % b);
    }

    /**
     * {@code a/b op c/d = n/m}.
     */
    private record Fractions(Expr a, Expr b, Expr c, Expr d, Operator op, Expr n, Expr m) {

        boolean isNumeric() {
            return integral(a) && integral(b) && integral(c) && integral(d) && integral(n) && integral(m);
        }

        long value(Expr expr) {
            return (long) ((Expr.Num) expr).value();
        }

        private static boolean integral(Expr expr) {
            return expr instanceof Expr.Num num && num.isInteger();
        }
    }
}
