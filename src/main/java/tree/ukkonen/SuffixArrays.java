package tree.ukkonen;

import java.util.Arrays;
import java.util.Comparator;

/**
 * SuffixArrays
 *
 * Provides:
 *   - buildLcpArray(text, sa): Kasai's Longest Common Prefix in linear time
 *   - naiveSuffixArray(text): sort of all suffixes by direct comparison
 *   - isPermutation / isSorted: checks used when cross-validating a suffix array
 *
 * All methods work on the text exactly as given; callers building from a
 * {@link SuffixTreeUkkonen} pass {@link SuffixTreeUkkonen#getText()}, which
 * includes the terminator.
 */
public final class SuffixArrays {

    private SuffixArrays() {
    }

    /**
     * Kasai's algorithm in linear time.
     * lcp[r] = LCP between suffix sa[r] and suffix sa[r+1].
     */
    public static int[] buildLcpArray(CharSequence text, int[] sa) {
        if (text == null || sa == null) {
            throw new IllegalArgumentException("text and sa must be non-null");
        }
        int n = text.length();
        if (sa.length != n) {
            throw new IllegalArgumentException("suffix array length " + sa.length
                    + " does not match text length " + n);
        }
        if (n == 0) {
            return new int[0];
        }

        int[] rank = new int[n];
        for (int i = 0; i < n; i++) {
            rank[sa[i]] = i;
        }

        int[] lcp = new int[n - 1];
        int h = 0;
        for (int i = 0; i < n; i++) {
            int r = rank[i];
            if (r == n - 1) {
                h = 0;
                continue;
            }
            int j = sa[r + 1];
            while (i + h < n && j + h < n && text.charAt(i + h) == text.charAt(j + h)) {
                h++;
            }
            lcp[r] = h;
            if (h > 0) {
                h--;
            }
        }
        return lcp;
    }

    // O(n^2 log n). Reference oracle, not meant for long texts.
    public static int[] naiveSuffixArray(CharSequence text) {
        if (text == null) {
            throw new IllegalArgumentException("text must be non-null");
        }
        String s = text.toString();
        Integer[] offsets = new Integer[s.length()];
        for (int i = 0; i < offsets.length; i++) {
            offsets[i] = i;
        }
        Arrays.sort(offsets, Comparator.comparing(s::substring));
        int[] sa = new int[offsets.length];
        for (int i = 0; i < sa.length; i++) {
            sa[i] = offsets[i];
        }
        return sa;
    }

    // True when sa holds every offset in [0, sa.length) exactly once.
    public static boolean isPermutation(int[] sa) {
        boolean[] seen = new boolean[sa.length];
        for (int offset : sa) {
            if (offset < 0 || offset >= sa.length || seen[offset]) {
                return false;
            }
            seen[offset] = true;
        }
        return true;
    }

    // True when consecutive suffixes are in strictly ascending order.
    public static boolean isSorted(CharSequence text, int[] sa) {
        for (int r = 0; r + 1 < sa.length; r++) {
            if (compareSuffixes(text, sa[r], sa[r + 1]) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static int compareSuffixes(CharSequence text, int a, int b) {
        int n = text.length();
        while (a < n && b < n) {
            char ca = text.charAt(a++);
            char cb = text.charAt(b++);
            if (ca != cb) {
                return ca < cb ? -1 : 1;
            }
        }
        // The shorter suffix is a prefix of the longer one.
        return Integer.compare(n - a, n - b);
    }
}
