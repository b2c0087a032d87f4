package org.localcompute.algebra.derivation.calculus;

import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces elementary function applications such as {@code sin(x^2)} or {@code e^(3x)} with
 * placeholder variables, so the expression grammar (which has no functions) can read them.
 * <p>
 * Equal applications share one placeholder. The table is built per derivative statement
 * and is not thread-safe.
 */
public class FunctionAtoms {

    private static final String ID_PREFIX = "__f";
    private static final Pattern ID_PATTERN = Pattern.compile(Pattern.quote(ID_PREFIX) + "\\d+");
    private static final List<String> FUNCTION_NAMES = List.of("sin", "cos", "tan", "exp", "ln", "log");

    /**
     * A function application replaced by a placeholder.
     *
     * @param id The placeholder variable name.
     * @param function The normalized function name: sin, cos, tan, exp or ln.
     * @param argument The argument tree, possibly containing other placeholders.
     */
    public record Atom(String id, String function, Expr argument) {
    }

    private final ExpressionReader reader;
    private final ExpressionFormatter formatter;
    private final Map<String, Atom> byKey = new HashMap<>();
    private final Map<String, Atom> byId = new HashMap<>();

    public FunctionAtoms(ExpressionReader reader, ExpressionFormatter formatter) {
        this.reader = reader;
        this.formatter = formatter;
    }

    /**
     * Replaces every function application in the text with its placeholder.
     *
     * @param text The text.
     * @return The rewritten text, or empty if a function argument could not be read.
     */
    public Optional<String> atomize(String text) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            Optional<Application> application = applicationAt(text, i);
            if (application.isEmpty()) {
                out.append(text.charAt(i));
                i++;
                continue;
            }
            Application app = application.get();
            Optional<String> inner = atomize(app.argumentText());
            if (inner.isEmpty()) {
                return Optional.empty();
            }
            ParseResult parsed = reader.read(inner.get());
            if (!parsed.success()) {
                return Optional.empty();
            }
            out.append(' ').append(atomFor(app.function(), parsed.expression()).id()).append(' ');
            i = app.end();
        }
        return Optional.of(out.toString());
    }

    /**
     * Returns the placeholder of a function application, registering it if needed.
     *
     * @param function The normalized function name.
     * @param argument The argument tree.
     * @return The atom.
     */
    public Atom atomFor(String function, Expr argument) {
        String key = function + "|" + formatter.format(argument);
        return byKey.computeIfAbsent(key, k -> {
            Atom atom = new Atom(ID_PREFIX + byKey.size(), function, argument);
            byId.put(atom.id(), atom);
            return atom;
        });
    }

    /**
     * @param variableName A variable name.
     * @return The atom behind a placeholder name, or empty for an ordinary variable.
     */
    public Optional<Atom> lookup(String variableName) {
        return Optional.ofNullable(byId.get(variableName));
    }

    /**
     * Renders a tree with every placeholder turned back into its function application.
     * @param expr The tree.
     * @return The display text.
     */
    public String render(Expr expr) {
        return restore(formatter.format(expr));
    }

    private String restore(String text) {
        Matcher matcher = ID_PATTERN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Atom atom = byId.get(matcher.group());
            String replacement = atom == null ? matcher.group() : display(atom);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String display(Atom atom) {
        String argument = render(atom.argument());
        if (atom.function().equals("exp")) {
            boolean simple = atom.argument() instanceof Expr.Var || atom.argument() instanceof Expr.Num;
            return simple ? "e^" + argument : "e^(" + argument + ")";
        }
        return atom.function() + "(" + argument + ")";
    }

    private Optional<Application> applicationAt(String text, int start) {
        if (start > 0 && (Character.isLetter(text.charAt(start - 1)) || text.charAt(start - 1) == '_')) {
            return Optional.empty();
        }
        for (String name : FUNCTION_NAMES) {
            if (text.regionMatches(true, start, name, 0, name.length())) {
                int open = skipSpaces(text, start + name.length());
                if (open < text.length() && text.charAt(open) == '(') {
                    int close = matchingParen(text, open);
                    if (close > 0) {
                        String function = normalize(name);
                        return Optional.of(new Application(function, text.substring(open + 1, close), close + 1));
                    }
                }
            }
        }
        if ((text.charAt(start) == 'e') && (start + 1 >= text.length() || !isIdentifierChar(text.charAt(start + 1)))) {
            int caret = skipSpaces(text, start + 1);
            if (caret < text.length() && text.charAt(caret) == '^') {
                int argStart = skipSpaces(text, caret + 1);
                if (argStart < text.length() && text.charAt(argStart) == '(') {
                    int close = matchingParen(text, argStart);
                    if (close > 0) {
                        return Optional.of(new Application("exp", text.substring(argStart + 1, close), close + 1));
                    }
                }
                int end = argStart;
                while (end < text.length() && (isIdentifierChar(text.charAt(end)) || text.charAt(end) == '.')) {
                    end++;
                }
                if (end > argStart) {
                    return Optional.of(new Application("exp", text.substring(argStart, end), end));
                }
            }
        }
        return Optional.empty();
    }

    private static String normalize(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("log") ? "ln" : lower;
    }

    private static int skipSpaces(String text, int index) {
        int i = index;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private record Application(String function, String argumentText, int end) {
    }
}
