package com.driftsentinel.core.detection;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compares declared and observed signatures after whitespace normalisation.
 *
 * <p>
 * Arity is the number of top-level comma-separated parameters inside the
 * outermost parentheses; commas nested in generic brackets, default values
 * or inner parentheses do not count.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignatureComparator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION_SPACING = Pattern.compile("\\s*([(),:<>\\[\\]{}=|*&])\\s*");

    /** Outcome of a comparison. */
    public enum Result {
        MATCH,
        /** Parameter count differs. */
        ARITY_MISMATCH,
        /** Same parameter count, different text (names, types, return type). */
        TEXT_MISMATCH
    }

    private SignatureComparator() {
    }

    public static Result compare(String expected, String actual) {
        Objects.requireNonNull(expected, "expected signature must not be null");
        Objects.requireNonNull(actual, "actual signature must not be null");

        String e = normalize(expected);
        String a = normalize(actual);
        if (e.equals(a)) {
            return Result.MATCH;
        }
        return arity(e) != arity(a) ? Result.ARITY_MISMATCH : Result.TEXT_MISMATCH;
    }

    /**
     * @param signature raw signature text
     * @return signature with whitespace collapsed and removed around punctuation
     */
    public static String normalize(String signature) {
        String collapsed = WHITESPACE.matcher(signature.trim()).replaceAll(" ");
        return PUNCTUATION_SPACING.matcher(collapsed).replaceAll("$1");
    }

    /**
     * @param signature signature text
     * @return number of top-level parameters, or {@code -1} if the signature
     *         has no parameter list
     */
    public static int arity(String signature) {
        int open = signature.indexOf('(');
        int close = matchingParen(signature, open);
        if (close < 0) {
            return -1;
        }
        String params = signature.substring(open + 1, close);
        if (params.isBlank()) {
            return 0;
        }
        int depth = 0;
        int count = 1;
        for (int i = 0; i < params.length(); i++) {
            char c = params.charAt(i);
            switch (c) {
                case '(', '<', '[', '{' -> depth++;
                case ')', '>', ']', '}' -> depth = Math.max(0, depth - 1);
                case ',' -> {
                    if (depth == 0) {
                        count++;
                    }
                }
                default -> {
                    // parameter text
                }
            }
        }
        return count;
    }

    private static int matchingParen(String text, int open) {
        if (open < 0) {
            return -1;
        }
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
