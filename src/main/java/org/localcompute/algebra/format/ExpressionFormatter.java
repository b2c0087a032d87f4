package org.localcompute.algebra.format;

import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.lexer.Token;
import org.localcompute.algebra.frontend.lexer.TokenType;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.math.BigDecimal;
import java.util.List;

/**
 * Renders expression trees and token streams as display text. The output of
 * {@link #format(Expr)} parses back into the same tree.
 */
public class ExpressionFormatter {

    private static final double MAX_EXACT_INTEGER = 1e15;

    /**
     * Formats a tree with {@link FormatOptions#DEFAULT}.
     * @param expr The tree.
     * @return The display text.
     */
    public String format(Expr expr) {
        return format(expr, FormatOptions.DEFAULT);
    }

    /**
     * Formats a tree.
     * @param expr The tree.
     * @param options The rendering options.
     * @return The display text.
     */
    public String format(Expr expr, FormatOptions options) {
        StringBuilder out = new StringBuilder();
        write(expr, options, out);
        return out.toString();
    }

    /**
     * Renders a token stream with canonical spacing. Implicit multiplications stay implicit,
     * so {@code 2x+3x} becomes {@code 2x + 3x}.
     *
     * @param tokens The tokens.
     * @return The normalized text.
     */
    public String formatTokens(List<Token> tokens) {
        StringBuilder out = new StringBuilder();
        for (Token token : tokens) {
            if (token.implicit()) {
                continue;
            }
            if (token.type() == TokenType.OPERATOR && !token.unary() && token.operator() != Operator.POWER) {
                out.append(' ').append(token.operator().symbol()).append(' ');
            } else if (token.type() == TokenType.OPERATOR) {
                out.append(token.operator().symbol());
            } else {
                out.append(token.text());
            }
        }
        return out.toString().trim();
    }

    /**
     * Formats a number: integers without a decimal point, everything else as a plain decimal.
     * @param value The value.
     * @return The text.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGER) {
            return Long.toString((long) value);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private void write(Expr expr, FormatOptions options, StringBuilder out) {
        if (expr instanceof Expr.Num n) {
            String text = formatNumber(n.value());
            out.append(options.unicode() && n.value() < 0 ? "−" + text.substring(1) : text);
        } else if (expr instanceof Expr.Var v) {
            out.append(v.name());
        } else if (expr instanceof Expr.Unary u) {
            writeUnary(u, options, out);
        } else {
            writeBinary((Expr.Binary) expr, options, out);
        }
    }

    private void writeUnary(Expr.Unary u, FormatOptions options, StringBuilder out) {
        if (u.op().isPostfix()) {
            boolean parens = u.operand() instanceof Expr.Binary || isNegative(u.operand());
            writeChild(u.operand(), parens, options, out);
            out.append(u.op().symbol());
            return;
        }
        out.append(symbol(u.op(), options));
        writeChild(u.operand(), u.operand() instanceof Expr.Binary, options, out);
    }

    private void writeBinary(Expr.Binary b, FormatOptions options, StringBuilder out) {
        writeChild(b.left(), needsParens(b, b.left(), true, options), options, out);
        if (options.spaces() && b.op() != Operator.POWER) {
            out.append(' ').append(symbol(b.op(), options)).append(' ');
        } else {
            out.append(symbol(b.op(), options));
        }
        writeChild(b.right(), needsParens(b, b.right(), false, options), options, out);
    }

    private void writeChild(Expr child, boolean parens, FormatOptions options, StringBuilder out) {
        if (parens) {
            out.append('(');
            write(child, options, out);
            out.append(')');
        } else {
            write(child, options, out);
        }
    }

    private static boolean needsParens(Expr.Binary parent, Expr child, boolean isLeft, FormatOptions options) {
        if (parent.op() == Operator.POWER && isLeft && isNegative(child)) {
            return true;
        }
        if (!(child instanceof Expr.Binary c)) {
            return false;
        }
        if (!options.minimalParens()) {
            return true;
        }
        int parentTier = parent.op().tier();
        int childTier = c.op().tier();
        if (childTier != parentTier) {
            return childTier < parentTier;
        }
        return isLeft == parent.op().isRightAssociative();
    }

    private static boolean isNegative(Expr expr) {
        return (expr instanceof Expr.Num n && n.value() < 0)
                || (expr instanceof Expr.Unary u && !u.op().isPostfix());
    }

    private static String symbol(Operator op, FormatOptions options) {
        return options.unicode() ? op.unicodeSymbol() : op.symbol();
    }
}
