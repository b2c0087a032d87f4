package org.localcompute.algebra.derivation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits free text into derivation steps. Segments are separated by line breaks, commas,
 * semicolons and the words "then", "so", "therefore" and "hence"; a segment with a chain
 * {@code a = b = c} yields one step per adjacent pair.
 */
public final class StepExtractor {

    private static final Pattern SEGMENT_SEPARATOR =
            Pattern.compile("[,;\\n]|\\bthen\\b|\\bso\\b|\\btherefore\\b|\\bhence\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_PHRASE =
            Pattern.compile("^(?:prove|show(?:\\s+that)?|verify|therefore|thus|hence|so|then)[:.]?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NOISE = Pattern.compile("^[^a-zA-Z0-9\\-−.(\\[{√]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?:]+$");

    private StepExtractor() {
    }

    /**
     * Extracts the steps of a derivation.
     * @param text The text, e.g. {@code "x + x = 2x, then 2x = 2*x"}.
     * @return The steps in order, empty if the text contains no equality.
     */
    public static List<DerivationStep> extract(String text) {
        List<DerivationStep> steps = new ArrayList<>();
        if (text == null) {
            return steps;
        }
        for (String segment : SEGMENT_SEPARATOR.split(text)) {
            if (segment.indexOf('=') < 0) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (String part : segment.split("=", -1)) {
                parts.add(clean(part));
            }
            for (int i = 0; i + 1 < parts.size(); i++) {
                if (!parts.get(i).isEmpty() && !parts.get(i + 1).isEmpty()) {
                    steps.add(new DerivationStep(parts.get(i), parts.get(i + 1)));
                }
            }
        }
        return steps;
    }

    /**
     * Removes non-mathematical lead-ins such as {@code "prove:"} or {@code "show that"} and trailing
     * sentence punctuation.
     *
     * @param part The raw text of one side.
     * @return The cleaned expression text.
     */
    public static String clean(String part) {
        String cleaned = part.trim();
        cleaned = LEADING_PHRASE.matcher(cleaned).replaceFirst("");
        cleaned = LEADING_NOISE.matcher(cleaned).replaceFirst("");
        cleaned = TRAILING_PUNCTUATION.matcher(cleaned.trim()).replaceFirst("");
        return cleaned.trim();
    }
}
