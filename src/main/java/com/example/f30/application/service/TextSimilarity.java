package com.example.f30.application.service;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Token-set similarity in [0,1] over case-folded, accent-stripped, whitespace-normalized strings.
 * Word order and repeated words do not matter; the score is symmetric and a string compared
 * with itself scores 1.0. A string whose tokens are all contained in the other also scores 1.0.
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    public static double tokenSetRatio(String left, String right) {
        Set<String> leftTokens = tokens(left);
        Set<String> rightTokens = tokens(right);
        if (leftTokens.isEmpty() && rightTokens.isEmpty()) {
            return 1.0;
        }
        if (leftTokens.isEmpty() || rightTokens.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> common = new TreeSet<>(leftTokens);
        common.retainAll(rightTokens);
        TreeSet<String> onlyLeft = new TreeSet<>(leftTokens);
        onlyLeft.removeAll(rightTokens);
        TreeSet<String> onlyRight = new TreeSet<>(rightTokens);
        onlyRight.removeAll(leftTokens);

        String intersection = String.join(" ", common);
        String combinedLeft = join(intersection, String.join(" ", onlyLeft));
        String combinedRight = join(intersection, String.join(" ", onlyRight));

        double best = ratio(combinedLeft, combinedRight);
        if (!intersection.isEmpty()) {
            best = Math.max(best, ratio(intersection, combinedLeft));
            best = Math.max(best, ratio(intersection, combinedRight));
        }
        return best;
    }

    /**
     * Case-folds, strips accents and punctuation, and collapses whitespace.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "");
        return decomposed.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim();
    }

    private static Set<String> tokens(String value) {
        String normalized = normalize(value);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toCollection(TreeSet::new));
    }

    private static String join(String head, String tail) {
        if (head.isEmpty()) {
            return tail;
        }
        return tail.isEmpty() ? head : head + " " + tail;
    }

    // 2 * LCS / total length; symmetric in its arguments
    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                current[j] = a.charAt(i - 1) == b.charAt(j - 1)
                        ? previous[j - 1] + 1
                        : Math.max(previous[j], current[j - 1]);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return 2.0 * previous[b.length()] / total;
    }
}
