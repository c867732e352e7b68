package io.github.reugn.stringly4j;

import java.util.List;
import java.util.Locale;

/**
 * Typo detection for "Did you mean ...?" hints in {@link UnknownFieldException}.
 */
final class Similarity {

    private Similarity() {
    }

    /**
     * Returns the candidate closest to {@code target} by case-insensitive edit distance.
     *
     * <p>A candidate qualifies only within {@code max(2, target.length() / 3)} edits; ties keep
     * the earlier candidate, so declaration order breaks them. A blank target has no match.
     *
     * <pre>{@code
     * findSimilar("innr", List.of("inner", "outer"))  // "inner"
     * findSimilar("zzz", List.of("inner"))            // null
     * findSimilar("", List.of("x"))                   // null
     * }</pre>
     *
     * @param target     the unmatched name
     * @param candidates the valid names
     * @return the best candidate, or {@code null} if none is close enough
     */
    static String findSimilar(String target, List<String> candidates) {
        if (target.isBlank()) {
            return null;
        }
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        int threshold = Math.max(2, target.length() / 3);
        String lowered = target.toLowerCase(Locale.ROOT);

        for (String candidate : candidates) {
            int distance = editDistance(lowered, candidate.toLowerCase(Locale.ROOT));
            if (distance < bestDistance && distance <= threshold) {
                bestDistance = distance;
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Levenshtein distance with two rolling rows.
     *
     * @param a first string
     * @param b second string
     * @return number of single-character insertions, deletions or substitutions turning a into b
     */
    static int editDistance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = prev[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                curr[j] = Math.min(substitution, Math.min(prev[j], curr[j - 1]) + 1);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[b.length()];
    }
}
