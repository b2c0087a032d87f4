package org.localcompute.algebra.latex;

/**
 * Layout options for rendering a derivation as LaTeX.
 *
 * @param align {@code align} environment with one line per step; otherwise a single {@code equation}.
 * @param numbered Appends {@code && \text{(n)}} to every aligned line.
 * @param therefore Starts the last aligned line with {@code \therefore} instead of {@code =}.
 * @param label The {@code \label} to attach, or {@code null}.
 */
public record LatexOptions(boolean align, boolean numbered, boolean therefore, String label) {

    public static final LatexOptions DEFAULT = new LatexOptions(true, false, false, null);

    public LatexOptions withAlign(boolean value) {
        return new LatexOptions(value, numbered, therefore, label);
    }

    public LatexOptions withNumbered(boolean value) {
        return new LatexOptions(align, value, therefore, label);
    }

    public LatexOptions withTherefore(boolean value) {
        return new LatexOptions(align, numbered, value, label);
    }

    public LatexOptions withLabel(String value) {
        return new LatexOptions(align, numbered, therefore, value);
    }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
