package org.localcompute.algebra.latex;

import org.localcompute.algebra.derivation.DerivationStep;
import org.localcompute.algebra.derivation.StepExtractor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders derivations as LaTeX. The conversion is textual; expressions are not parsed, so
 * anything the rules below do not recognize passes through unchanged.
 */
public class LatexRenderer {

    private static final Pattern MULTIPLY = Pattern.compile("\\s*[*·×]\\s*");
    private static final Pattern DIVIDE = Pattern.compile("\\s*÷\\s*");
    private static final Pattern POWER_NUMBER = Pattern.compile("\\^(\\d+)");
    private static final Pattern POWER_LETTER = Pattern.compile("\\^([a-zA-Z])");
    private static final Pattern SQRT_CALL = Pattern.compile("(?i)sqrt\\(([^)]+)\\)");
    private static final Pattern ROOT_GROUP = Pattern.compile("√\\s*\\(([^)]+)\\)");
    private static final Pattern ROOT_ATOM = Pattern.compile("√\\s*([A-Za-z0-9_.]+)");
    private static final Pattern FUNCTION = Pattern.compile("\\b(sin|cos|tan|log|ln|exp)\\b");
    private static final Pattern PI = Pattern.compile("(?i)\\bpi\\b");
    private static final Pattern FRACTION = Pattern.compile("(\\d+)\\s*/\\s*(\\d+)");

    /**
     * Renders the steps. An empty list gives an empty string.
     *
     * @param steps The steps.
     * @param options The layout.
     * @return The LaTeX source.
     */
    public String render(List<DerivationStep> steps, LatexOptions options) {
        if (steps.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        String labelSuffix = options.hasLabel() ? "\\label{" + options.label() + "}" : "";
        if (!options.align()) {
            StringBuilder chain = new StringBuilder(toLatex(steps.get(0).lhs()));
            for (DerivationStep step : steps) {
                chain.append(" = ").append(toLatex(step.rhs()));
            }
            lines.add("\\begin{equation}" + labelSuffix);
            lines.add("  " + chain);
            lines.add("\\end{equation}");
            return String.join("\n", lines);
        }

        lines.add("\\begin{align}" + labelSuffix);
        for (int i = 0; i < steps.size(); i++) {
            DerivationStep step = steps.get(i);
            boolean last = i == steps.size() - 1;
            StringBuilder line = new StringBuilder("  ");
            if (i == 0) {
                line.append(toLatex(step.lhs())).append(" &= ");
            } else if (options.therefore() && last) {
                line.append("&\\therefore ");
            } else {
                line.append("&= ");
            }
            line.append(toLatex(step.rhs()));
            if (options.numbered()) {
                line.append(" && \\text{(").append(i + 1).append(")}");
            }
            if (!last) {
                line.append(" \\\\");
            }
            lines.add(line.toString());
        }
        lines.add("\\end{align}");
        return String.join("\n", lines);
    }

    /**
     * Extracts the steps from text and renders them.
     * @param text The derivation text.
     * @param options The layout.
     * @return The LaTeX source, empty if the text holds no steps.
     */
    public String renderText(String text, LatexOptions options) {
        return render(StepExtractor.extract(text), options);
    }

    /**
     * Converts one expression to LaTeX notation.
     * @param expression The expression text.
     * @return The LaTeX form.
     */
    public String toLatex(String expression) {
        String result = expression.trim();
        result = MULTIPLY.matcher(result).replaceAll(" \\\\cdot ");
        result = DIVIDE.matcher(result).replaceAll(" \\\\div ");
        result = result.replace("²", "^{2}").replace("³", "^{3}");
        result = POWER_NUMBER.matcher(result).replaceAll("^{$1}");
        result = POWER_LETTER.matcher(result).replaceAll("^{$1}");
        result = SQRT_CALL.matcher(result).replaceAll("\\\\sqrt{$1}");
        result = ROOT_GROUP.matcher(result).replaceAll("\\\\sqrt{$1}");
        result = ROOT_ATOM.matcher(result).replaceAll("\\\\sqrt{$1}");
        result = FUNCTION.matcher(result).replaceAll("\\\\$1");
        result = PI.matcher(result).replaceAll("\\\\pi");
        result = FRACTION.matcher(result).replaceAll("\\\\frac{$1}{$2}");
        return result.replace('−', '-');
    }
}
