package com.querypilot.schema;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks identifier names by similarity to a misspelled or hallucinated one.
 */
public final class NameSimilarity {

    private static final double MIN_SIMILARITY = 0.4d;

    private NameSimilarity() {
    }

    public static double similarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0d;
        }
        String s1 = a.toUpperCase(Locale.ROOT);
        String s2 = b.toUpperCase(Locale.ROOT);
        if (s1.equals(s2)) {
            return 1.0d;
        }
        String norm1 = s1.replace("_", "");
        String norm2 = s2.replace("_", "");
        if (norm1.equals(norm2)) {
            return 0.9d;
        }
        if (singular(norm1).equals(singular(norm2))) {
            return 0.85d;
        }
        if (s1.contains(s2) || s2.contains(s1)) {
            return 0.7d;
        }
        int distance = levenshtein(s1, s2);
        double maxLen = Math.max(s1.length(), s2.length());
        return 1.0d - (distance / maxLen);
    }

    /**
     * Candidates above the similarity floor, best first, at most {@code limit}.
     */
    public static List<String> rank(String name, Collection<String> candidates, int limit) {
        return candidates.stream()
                .map(candidate -> new Scored(candidate, similarity(name, candidate)))
                .filter(scored -> scored.score >= MIN_SIMILARITY)
                .sorted(Comparator.comparingDouble(Scored::score).reversed().thenComparing(Scored::name))
                .limit(limit)
                .map(Scored::name)
                .toList();
    }

    private static String singular(String s) {
        if (s.endsWith("IES") && s.length() > 3) {
            return s.substring(0, s.length() - 3) + "Y";
        }
        if (s.endsWith("S") && s.length() > 1) {
            return s.substring(0, s.length() - 1);
        }
        return s;
    }

    private static int levenshtein(String s1, String s2) {
        int[][] dp = new int[s1.length() + 1][s2.length() + 1];
        for (int i = 0; i <= s1.length(); i++) {
            dp[i][0] = i;
        }
        for (int j = 0; j <= s2.length(); j++) {
            dp[0][j] = j;
        }
        for (int i = 1; i <= s1.length(); i++) {
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }
        return dp[s1.length()][s2.length()];
    }

    private record Scored(String name, double score) {
    }
}
