package org.localcompute.algebra.frontend.parser.ast;

import org.localcompute.algebra.frontend.lexer.Operator;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * An immutable expression tree node. Transformations always build new trees;
 * structural equality comes from the record implementations.
 */
public sealed interface Expr permits Expr.Num, Expr.Var, Expr.Unary, Expr.Binary {

    /**
     * Returns a list of the direct child nodes, so a generic {@link ExprWalker}
     * can traverse the tree without knowing its node types.
     *
     * @return The child nodes, empty for leaves.
     */
    default List<Expr> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children.
     *
     * @param newChildren The new children, in {@link #getChildren()} order.
     * @return The rebuilt node, or this node for leaves.
     */
    default Expr reconstructWithChildren(List<Expr> newChildren) {
        return this;
    }

    /**
     * @return The names of all variables in this tree, sorted.
     */
    default Set<String> freeVariables() {
        Set<String> names = new TreeSet<>();
        new ExprWalker().walk(this, node -> {
            if (node instanceof Var v) {
                names.add(v.name());
            }
        });
        return names;
    }

    /**
     * @return Whether the tree consists of numeric literals and operators only.
     */
    default boolean isConstant() {
        return freeVariables().isEmpty();
    }

    static Num num(double value) {
        return new Num(value);
    }

    static Var var(String name) {
        return new Var(name);
    }

    static Unary unary(Operator op, Expr operand) {
        return new Unary(op, operand);
    }

    static Binary binary(Operator op, Expr left, Expr right) {
        return new Binary(op, left, right);
    }

    static Unary negate(Expr operand) {
        return new Unary(Operator.SUBTRACT, operand);
    }

    static Binary add(Expr left, Expr right) {
        return new Binary(Operator.ADD, left, right);
    }

    static Binary subtract(Expr left, Expr right) {
        return new Binary(Operator.SUBTRACT, left, right);
    }

    static Binary multiply(Expr left, Expr right) {
        return new Binary(Operator.MULTIPLY, left, right);
    }

    static Binary divide(Expr left, Expr right) {
        return new Binary(Operator.DIVIDE, left, right);
    }

    static Binary power(Expr base, Expr exponent) {
        return new Binary(Operator.POWER, base, exponent);
    }

    /**
     * A numeric literal. Negative zero is stored as positive zero.
     *
     * @param value The value.
     */
    record Num(double value) implements Expr {
        public Num {
            if (value == 0.0) {
                value = 0.0;
            }
        }

        public boolean is(double other) {
            return value == other;
        }

        public boolean isInteger() {
            return value == Math.rint(value) && !Double.isInfinite(value);
        }
    }

    /**
     * A variable reference.
     *
     * @param name The variable name.
     */
    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * A prefix or postfix operator application: negation, unary plus, root, square or cube.
     *
     * @param op The operator.
     * @param operand The operand.
     */
    record Unary(Operator op, Expr operand) implements Expr {
        @Override
        public List<Expr> getChildren() {
            return List.of(operand);
        }

        @Override
        public Expr reconstructWithChildren(List<Expr> newChildren) {
            return new Unary(op, newChildren.get(0));
        }

        public boolean isNegation() {
            return op == Operator.SUBTRACT;
        }
    }

    /**
     * A binary operator application.
     *
     * @param op The operator.
     * @param left The left operand.
     * @param right The right operand.
     */
    record Binary(Operator op, Expr left, Expr right) implements Expr {
        @Override
        public List<Expr> getChildren() {
            return List.of(left, right);
        }

        @Override
        public Expr reconstructWithChildren(List<Expr> newChildren) {
            return new Binary(op, newChildren.get(0), newChildren.get(1));
        }

        public boolean is(Operator other) {
            return op == other;
        }
    }
}
