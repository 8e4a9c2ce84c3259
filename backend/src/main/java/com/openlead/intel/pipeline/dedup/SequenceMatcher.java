package com.openlead.intel.pipeline.dedup;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp ("gestalt") string similarity over UTF-16 code units.
 * Finds the longest common block, then recurses on both sides of it; the ratio is
 * {@code 2*M / (|a| + |b|)} where M is the total size of the matched blocks.
 * No junk heuristics are applied.
 */
public final class SequenceMatcher {
    private final String a;
    private final String b;
    private final Map<Character, List<Integer>> b2j = new HashMap<>();

    public SequenceMatcher(String a, String b) {
        this.a = a == null ? "" : a;
        this.b = b == null ? "" : b;
        for (int j = 0; j < this.b.length(); j++) {
            b2j.computeIfAbsent(this.b.charAt(j), ignored -> new ArrayList<>()).add(j);
        }
    }

    public static double ratio(String a, String b) {
        return new SequenceMatcher(a, b).ratio();
    }

    public double ratio() {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters() / total;
    }

    public int matchingCharacters() {
        int matches = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[] {0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];
            int[] match = findLongestMatch(alo, ahi, blo, bhi);
            int i = match[0];
            int j = match[1];
            int size = match[2];
            if (size == 0) {
                continue;
            }
            matches += size;
            if (alo < i && blo < j) {
                queue.push(new int[] {alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                queue.push(new int[] {i + size, ahi, j + size, bhi});
            }
        }
        return matches;
    }

    /**
     * Longest common block inside {@code a[alo:ahi]} and {@code b[blo:bhi]}. Among equally long
     * blocks, the one starting earliest in {@code a} wins, then earliest in {@code b}.
     */
    int[] findLongestMatch(int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;
        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newJ2len = new HashMap<>();
            List<Integer> positions = b2j.get(a.charAt(i));
            if (positions != null) {
                for (int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len.getOrDefault(j - 1, 0) + 1;
                    newJ2len.put(j, k);
                    if (k > bestSize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            j2len = newJ2len;
        }
        return new int[] {besti, bestj, bestSize};
    }
}
