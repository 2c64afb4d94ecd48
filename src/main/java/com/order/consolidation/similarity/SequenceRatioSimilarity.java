package com.order.consolidation.similarity;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp "gestalt" similarity.
 * Finds the longest common block, recurses on both sides of it, and scores
 * {@code 2 * M / T} where M is the total size of the matched blocks and T the
 * combined length of both strings.
 *
 * <p>When several blocks share the maximum length, the one starting earliest in
 * the first string wins, then the earliest in the second. Two empty strings are
 * identical.</p>
 */
public class SequenceRatioSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    @Override
    public String getName() {
        return "SequenceRatio";
    }

    /**
     * Sums the sizes of all matching blocks between the two strings.
     */
    int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});

        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];

            int[] block = longestMatch(a, b, alo, ahi, blo, bhi);
            int i = block[0];
            int j = block[1];
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                queue.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                queue.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest common substring of {@code a[alo:ahi]} and {@code b[blo:bhi]}.
     *
     * @return {start in a, start in b, length}
     */
    private int[] longestMatch(String a, String b, int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;
        // previous[j - blo + 1] is the length of the common run ending at a[i - 1], b[j]
        int[] previous = new int[bhi - blo + 1];

        for (int i = alo; i < ahi; i++) {
            int[] current = new int[bhi - blo + 1];
            char c = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (b.charAt(j) != c) {
                    continue;
                }
                int k = previous[j - blo] + 1;
                current[j - blo + 1] = k;
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            previous = current;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
