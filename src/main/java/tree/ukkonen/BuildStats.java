package tree.ukkonen;

import java.util.Locale;

/**
 * Counters collected while a suffix tree is built. When collection is disabled
 * the record methods do nothing and every getter returns zero.
 */
public final class BuildStats {

    private final boolean collecting;
    private int phases;
    private int leaves;
    private int internalNodes;
    private int splits;
    private int walkDowns;
    private int suffixLinkHops;
    private int showstoppers;
    private long buildNanos;

    BuildStats(boolean collecting) {
        this.collecting = collecting;
    }

    public boolean isCollecting() {
        return collecting;
    }

    void recordPhase() {
        if (collecting) phases++;
    }

    void recordLeaf() {
        if (collecting) leaves++;
    }

    // Every split creates exactly one internal node.
    void recordSplit() {
        if (collecting) {
            splits++;
            internalNodes++;
        }
    }

    void recordWalkDown() {
        if (collecting) walkDowns++;
    }

    void recordSuffixLinkHop() {
        if (collecting) suffixLinkHops++;
    }

    void recordShowstopper() {
        if (collecting) showstoppers++;
    }

    void recordBuildTime(long nanos) {
        if (collecting) buildNanos = nanos;
    }

    public int phases() { return phases; }

    public int leaves() { return leaves; }

    // Root excluded.
    public int internalNodes() { return internalNodes; }

    public int splits() { return splits; }

    public int walkDowns() { return walkDowns; }

    public int suffixLinkHops() { return suffixLinkHops; }

    public int showstoppers() { return showstoppers; }

    public long buildNanos() { return buildNanos; }

    @Override
    public String toString() {
        if (!collecting) {
            return "BuildStats{disabled}";
        }
        return String.format(Locale.ROOT,
                "BuildStats{phases=%d, leaves=%d, internalNodes=%d, splits=%d, walkDowns=%d, "
                        + "suffixLinkHops=%d, showstoppers=%d, buildMs=%.3f}",
                phases, leaves, internalNodes, splits, walkDowns, suffixLinkHops, showstoppers,
                buildNanos / 1e6);
    }
}
