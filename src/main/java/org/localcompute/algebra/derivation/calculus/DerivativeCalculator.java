package org.localcompute.algebra.derivation.calculus;

import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Simplifier;

import java.util.Optional;

/**
 * Differentiates polynomial-style expressions: sums, products, quotients, powers with
 * constant exponents, roots, and the elementary functions held in {@link FunctionAtoms}.
 * <p>
 * It exists to compute the correct answer of derivative steps; it does not integrate and
 * gives up (returns empty) on anything else, e.g. {@code x^x}.
 */
public class DerivativeCalculator {

    private final ExpressionReader reader;
    private final Simplifier simplifier;
    private final ExpressionFormatter formatter;

    public DerivativeCalculator(ExpressionReader reader, Simplifier simplifier, ExpressionFormatter formatter) {
        this.reader = reader;
        this.simplifier = simplifier;
        this.formatter = formatter;
    }

    /**
     * Reads a derivative step.
     *
     * @param lhs The left-hand side, e.g. {@code d/dx sin(x^2)}.
     * @param rhs The claimed derivative.
     * @return The problem, or empty if the left side is no derivative request or a side cannot be read.
     */
    public Optional<DerivativeProblem> read(String lhs, String rhs) {
        Optional<DerivativeStatement> statement = DerivativeStatement.parse(lhs);
        if (statement.isEmpty()) {
            return Optional.empty();
        }
        FunctionAtoms atoms = new FunctionAtoms(reader, formatter);
        Optional<Expr> body = atoms.atomize(statement.get().body()).flatMap(this::tree);
        Optional<Expr> claimed = atoms.atomize(rhs).flatMap(this::tree);
        if (body.isEmpty() || claimed.isEmpty()) {
            return Optional.empty();
        }
        String variable = statement.get().variable();
        Expr expected = differentiate(body.get(), variable, atoms).orElse(null);
        return Optional.of(new DerivativeProblem(variable, body.get(), claimed.get(), expected, atoms));
    }

    /**
     * Differentiates and simplifies.
     * @param expr The expression.
     * @param variable The variable of differentiation.
     * @param atoms The placeholder table of function applications in {@code expr}.
     * @return The simplified derivative, or empty if unsupported.
     */
    public Optional<Expr> differentiate(Expr expr, String variable, FunctionAtoms atoms) {
        try {
            return Optional.of(simplifier.simplify(derive(expr, variable, atoms)));
        } catch (UnsupportedOperationException e) {
            return Optional.empty();
        }
    }

    /**
     * The derivative of the outermost function of a composite, evaluated at its inner expression,
     * without the inner derivative factor; {@code sin(x^2)} gives {@code cos(x^2)}.
     *
     * @param expr The composite.
     * @param variable The variable of differentiation.
     * @param atoms The placeholder table.
     * @return The outer derivative, or empty if {@code expr} is not a composite.
     */
    public Optional<Expr> outerDerivative(Expr expr, String variable, FunctionAtoms atoms) {
        Optional<Expr> outer = Optional.empty();
        if (expr instanceof Expr.Var v && atoms.lookup(v.name()).isPresent()) {
            FunctionAtoms.Atom atom = atoms.lookup(v.name()).get();
            outer = Optional.of(functionDerivative(atom, atoms));
        } else if (expr instanceof Expr.Binary b && b.op() == Operator.POWER && !dependsOn(b.right(), variable, atoms)) {
            outer = Optional.of(Expr.multiply(b.right(), Expr.power(b.left(), Expr.subtract(b.right(), Expr.num(1)))));
        } else if (expr instanceof Expr.Unary u) {
            outer = switch (u.op()) {
                case SQUARE -> Optional.of(Expr.multiply(Expr.num(2), u.operand()));
                case CUBE -> Optional.of(Expr.multiply(Expr.num(3), Expr.power(u.operand(), Expr.num(2))));
                case SQRT -> Optional.of(Expr.divide(Expr.num(1), Expr.multiply(Expr.num(2), u)));
                default -> Optional.empty();
            };
        }
        return outer.map(simplifier::simplify);
    }

    /**
     * @param expr An expression.
     * @param variable A variable.
     * @param atoms The placeholder table.
     * @return Whether the expression depends on the variable, also through function arguments.
     */
    public boolean dependsOn(Expr expr, String variable, FunctionAtoms atoms) {
        if (expr instanceof Expr.Var v) {
            if (v.name().equals(variable)) {
                return true;
            }
            return atoms.lookup(v.name()).map(a -> dependsOn(a.argument(), variable, atoms)).orElse(false);
        }
        for (Expr child : expr.getChildren()) {
            if (dependsOn(child, variable, atoms)) {
                return true;
            }
        }
        return false;
    }

    private Expr derive(Expr expr, String variable, FunctionAtoms atoms) {
        if (!dependsOn(expr, variable, atoms)) {
            return Expr.num(0);
        }
        if (expr instanceof Expr.Var v) {
            if (v.name().equals(variable)) {
                return Expr.num(1);
            }
            FunctionAtoms.Atom atom = atoms.lookup(v.name()).orElseThrow(UnsupportedOperationException::new);
            return chain(derive(atom.argument(), variable, atoms), functionDerivative(atom, atoms));
        }
        if (expr instanceof Expr.Unary u) {
            Expr du = derive(u.operand(), variable, atoms);
            return switch (u.op()) {
                case SUBTRACT -> Expr.negate(du);
                case ADD -> du;
                case SQRT -> Expr.divide(du, Expr.multiply(Expr.num(2), u));
                case SQUARE -> chain(du, Expr.multiply(Expr.num(2), u.operand()));
                case CUBE -> chain(du, Expr.multiply(Expr.num(3), Expr.power(u.operand(), Expr.num(2))));
                default -> throw new UnsupportedOperationException(u.op().name());
            };
        }
        Expr.Binary b = (Expr.Binary) expr;
        Expr u = b.left();
        Expr v = b.right();
        switch (b.op()) {
            case ADD:
                return Expr.add(derive(u, variable, atoms), derive(v, variable, atoms));
            case SUBTRACT:
                return Expr.subtract(derive(u, variable, atoms), derive(v, variable, atoms));
            case MULTIPLY:
                return Expr.add(
                        Expr.multiply(derive(u, variable, atoms), v),
                        Expr.multiply(u, derive(v, variable, atoms)));
            case DIVIDE:
                if (!dependsOn(v, variable, atoms)) {
                    return Expr.divide(derive(u, variable, atoms), v);
                }
                return Expr.divide(
                        Expr.subtract(
                                Expr.multiply(derive(u, variable, atoms), v),
                                Expr.multiply(u, derive(v, variable, atoms))),
                        Expr.power(v, Expr.num(2)));
            case POWER:
                if (!dependsOn(v, variable, atoms)) {
                    Expr reduced = Expr.power(u, Expr.subtract(v, Expr.num(1)));
                    return chain(derive(u, variable, atoms), Expr.multiply(v, reduced));
                }
                if (!dependsOn(u, variable, atoms)) {
                    Expr ln = Expr.var(atoms.atomFor("ln", u).id());
                    return chain(derive(v, variable, atoms), Expr.multiply(b, ln));
                }
                throw new UnsupportedOperationException("variable base and exponent");
            default:
                throw new UnsupportedOperationException(b.op().name());
        }
    }

    /**
     * The derivative of a function at its argument, without the argument's derivative.
     */
    private static Expr functionDerivative(FunctionAtoms.Atom atom, FunctionAtoms atoms) {
        Expr argument = atom.argument();
        return switch (atom.function()) {
            case "sin" -> Expr.var(atoms.atomFor("cos", argument).id());
            case "cos" -> Expr.negate(Expr.var(atoms.atomFor("sin", argument).id()));
            case "tan" -> Expr.divide(Expr.num(1), Expr.power(Expr.var(atoms.atomFor("cos", argument).id()), Expr.num(2)));
            case "exp" -> Expr.var(atom.id());
            case "ln" -> Expr.divide(Expr.num(1), argument);
            default -> throw new UnsupportedOperationException(atom.function());
        };
    }

    private static Expr chain(Expr inner, Expr outer) {
        return Expr.multiply(inner, outer);
    }

    private Optional<Expr> tree(String text) {
        ParseResult parsed = reader.read(text);
        return parsed.success() ? Optional.of(parsed.expression()) : Optional.empty();
    }
}
