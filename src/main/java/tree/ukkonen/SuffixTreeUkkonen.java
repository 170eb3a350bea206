package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import utilities.SuffixTreeLogger;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Objects;

// Suffix tree over a fixed character range, built online with Ukkonen's algorithm.
public final class SuffixTreeUkkonen {

    // Root of the suffix tree.
    private final Node root;

    // Full text including the terminator.
    private final char[] text;

    // Length of the original text before appending the terminator.
    private final int originalLength;

    private final Alphabet alphabet;

    private final BuildStats stats;

    SuffixTreeUkkonen(Node root, char[] text, int originalLength, Alphabet alphabet, BuildStats stats) {
        this.root = root;
        this.text = text;
        this.originalLength = originalLength;
        this.alphabet = alphabet;
        this.stats = stats;
    }

    // Build a suffix tree for the given text over the default printable alphabet.
    public static SuffixTreeUkkonen build(String text) {
        return build(text, SuffixTreeConfiguration.defaults());
    }

    public static SuffixTreeUkkonen build(String text, SuffixTreeConfiguration config) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        Objects.requireNonNull(config, "config");
        Alphabet alphabet = config.alphabet();

        // Reject before anything is allocated
        alphabet.validate(text);

        // Append terminator
        char[] terminated = Arrays.copyOf(text.toCharArray(), text.length() + 1);
        terminated[terminated.length - 1] = alphabet.terminator();

        BuildStats stats = new BuildStats(config.collectStats());
        long startNanos = System.nanoTime();
        Node builtRoot = new UkkonenBuilder(terminated, alphabet, stats).build();
        stats.recordBuildTime(System.nanoTime() - startNanos);

        SuffixTreeUkkonen tree = new SuffixTreeUkkonen(builtRoot, terminated, text.length(), alphabet, stats);
        if (config.verifyInvariants()) {
            tree.verifyInvariants();
        }
        if (SuffixTreeLogger.isDebugEnabled()) {
            SuffixTreeLogger.debug("Built suffix tree for " + text.length() + " chars in "
                    + (System.nanoTime() - startNanos) / 1_000 + " us"
                    + (stats.isCollecting() ? " " + stats : ""));
        }
        return tree;
    }

    public Node getRoot() {
        return root;
    }

    // Text with the terminator appended.
    public String getText() {
        return new String(text);
    }

    public int getOriginalLength() {
        return originalLength;
    }

    public Alphabet getAlphabet() {
        return alphabet;
    }

    public BuildStats getStats() {
        return stats;
    }

    public int[] toSuffixArray() {
        return SuffixArrayExtractor.extract(this);
    }

    public boolean contains(String pattern) {
        return locate(pattern) != null;
    }

    public int countOccurrences(String pattern) {
        return findOccurrences(pattern).size();
    }

    // Starting offsets of every occurrence of pattern in the original text, ascending.
    public IntList findOccurrences(String pattern) {
        Edge edge = locate(pattern);
        if (edge == null) {
            return IntLists.emptyList();
        }
        IntArrayList matches = new IntArrayList();
        if (edge.isLeaf()) {
            matches.add(edge.suffixId);
        } else {
            SuffixArrayExtractor.collectLeaves(edge.child, matches);
        }
        int[] sorted = matches.toIntArray();
        Arrays.sort(sorted);
        return IntArrayList.wrap(sorted);
    }

    /**
     * Return the edge on which the match of pattern ends, or null when the
     * pattern does not occur. Every leaf below that point is an occurrence.
     */
    private Edge locate(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return null;
        }
        for (int i = 0; i < pattern.length(); i++) {
            if (!alphabet.isContent(pattern.charAt(i))) {
                return null;
            }
        }

        Node current = root;
        int patternIndex = 0;
        while (current != null) {
            Edge edge = current.edges[alphabet.index(pattern.charAt(patternIndex))];
            if (edge == null) {
                return null;
            }
            int edgeLength = edge.length();
            int consumed = 0;
            while (consumed < edgeLength && patternIndex < pattern.length()) {
                if (text[edge.start + consumed] != pattern.charAt(patternIndex)) {
                    return null;
                }
                consumed++;
                patternIndex++;
            }
            if (patternIndex == pattern.length()) {
                return edge;
            }
            current = edge.child;
        }
        // Ran off a leaf; only the terminator lies there.
        return null;
    }

    /**
     * Walk the finished tree once and check its structural invariants.
     *
     * @throws IllegalStateException on the first violation found
     */
    public void verifyInvariants() {
        int leaves = 0;
        ArrayDeque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!node.isRoot() && node.suffixLink == null) {
                throw new IllegalStateException("internal node without suffix link");
            }
            int outgoing = 0;
            for (Edge edge : node.edges) {
                if (edge == null) {
                    continue;
                }
                outgoing++;
                edge.checkShape();
                if (edge.length() < 1) {
                    throw new IllegalStateException("edge starting at " + edge.start
                            + " has length " + edge.length());
                }
                if (edge.isLeaf()) {
                    leaves++;
                } else {
                    stack.push(edge.child);
                }
            }
            if (!node.isRoot() && outgoing < 2) {
                throw new IllegalStateException("internal node with " + outgoing + " outgoing edges");
            }
        }
        if (leaves != text.length) {
            throw new IllegalStateException("expected " + text.length + " leaves but found " + leaves);
        }
    }

    // Node in the suffix tree. Edges are addressed by alphabet slot.
    public static final class Node {
        private final Edge[] edges;
        private final boolean root;

        // Non-owning; set once when the node is linked during construction.
        private Node suffixLink;

        Node(int alphabetLength, boolean root) {
            this.edges = new Edge[alphabetLength];
            this.root = root;
        }

        static Node root(int alphabetLength) {
            Node node = new Node(alphabetLength, true);
            node.suffixLink = node;
            return node;
        }

        void linkTo(Node target) {
            if (suffixLink != null) {
                throw new IllegalStateException("suffix link already set");
            }
            suffixLink = target;
        }

        void putEdge(int slot, Edge edge) {
            edges[slot] = edge;
        }

        public Edge getEdge(int slot) {
            return edges[slot];
        }

        public int slotCount() {
            return edges.length;
        }

        public Node getSuffixLink() {
            return suffixLink;
        }

        public boolean isRoot() {
            return root;
        }
    }

    // Edge labelled text[start..end], both ends inclusive.
    public static final class Edge {
        private int start;
        private final EndRef end;

        // Exactly one of child / suffixId is present.
        private final Node child;
        private final int suffixId;

        Edge(int start, EndRef end, Node child, int suffixId) {
            this.start = start;
            this.end = end;
            this.child = child;
            this.suffixId = suffixId;
        }

        static Edge leaf(int start, EndRef end, int suffixId) {
            return new Edge(start, end, null, suffixId);
        }

        static Edge internal(int start, EndRef end, Node child) {
            return new Edge(start, end, child, -1);
        }

        public int getStart() {
            return start;
        }

        // Inclusive end, read through the shared marker for open edges.
        public int getEnd() {
            return end.value;
        }

        public int length() {
            return end.value - start + 1;
        }

        public Node getChild() {
            return child;
        }

        // Starting offset of the suffix ending at this leaf, -1 for internal edges.
        public int getSuffixId() {
            return suffixId;
        }

        public boolean isLeaf() {
            return child == null;
        }

        public boolean isOpen() {
            return end.shared;
        }

        void checkShape() {
            if ((child == null) == (suffixId < 0)) {
                throw new IllegalStateException("edge starting at " + start
                        + " must have either a child or a suffix id");
            }
        }
    }

    /**
     * Integer cell for an edge end. The shared instance is advanced once per
     * phase, which extends every open leaf edge in O(1). Split edges get their
     * own fixed instance and never see the shared one again.
     */
    static final class EndRef {
        private int value;
        private final boolean shared;

        EndRef(int value, boolean shared) {
            this.value = value;
            this.shared = shared;
        }

        static EndRef shared() {
            return new EndRef(-1, true);
        }

        static EndRef fixed(int value) {
            return new EndRef(value, false);
        }

        void advance(int phase) {
            value = phase;
        }
    }

    // Where the next character has to be inserted.
    private static final class ActivePoint {
        Node node;
        int edgeIndex = -1;   // index in text naming the active edge
        int length;           // symbols matched along that edge

        ActivePoint(Node root) {
            this.node = root;
        }
    }

    /**
     * Runs Ukkonen's algorithm over the terminated text, one phase per
     * character. Total work is O(n) amortised over the whole build.
     */
    private static final class UkkonenBuilder {
        private final char[] text;
        private final Alphabet alphabet;
        private final Node root;
        private final EndRef leafEnd;
        private final ActivePoint active;
        private final BuildStats stats;

        // Suffixes still owed an explicit insertion
        private int remainder;
        private Node lastNewInternalNode;

        UkkonenBuilder(char[] text, Alphabet alphabet, BuildStats stats) {
            this.text = text;
            this.alphabet = alphabet;
            this.root = Node.root(alphabet.length());
            this.leafEnd = EndRef.shared();
            this.active = new ActivePoint(root);
            this.stats = stats;
        }

        Node build() {
            for (int phase = 0; phase < text.length; phase++) {
                extend(phase);
            }
            return root;
        }

        /**
         * Phase i. Every open leaf grows by one character through the shared
         * end, then the pending suffixes are inserted until one is already
         * present (showstopper) or none are left.
         */
        private void extend(int i) {
            leafEnd.advance(i);
            remainder++;
            lastNewInternalNode = null;
            stats.recordPhase();

            char current = text[i];

            while (remainder > 0) {
                if (active.length == 0) {
                    active.edgeIndex = i;
                }

                int slot = alphabet.index(text[active.edgeIndex]);
                Edge edge = active.node.edges[slot];

                if (edge == null) {
                    // No edge starts with this character: hang a new leaf off the active node.
                    active.node.putEdge(slot, Edge.leaf(i, leafEnd, i - remainder + 1));
                    stats.recordLeaf();
                    linkPendingTo(active.node);
                } else {
                    if (walkDown(edge)) {
                        continue;
                    }

                    if (text[edge.start + active.length] == current) {
                        // Already in the tree, and so is every shorter pending suffix.
                        active.length++;
                        linkPendingTo(active.node);
                        stats.recordShowstopper();
                        return;
                    }

                    split(edge, slot, i);
                }

                remainder--;

                if (active.node == root && active.length > 0) {
                    active.length--;
                    active.edgeIndex = i - remainder + 1;
                } else {
                    followSuffixLink();
                }
            }
        }

        // Move past edge when the active length covers it. Returns true if moved.
        private boolean walkDown(Edge edge) {
            int edgeLength = edge.length();
            if (active.length < edgeLength) {
                return false;
            }
            if (edge.child == null) {
                throw new IllegalStateException("active length " + active.length
                        + " runs past leaf edge starting at " + edge.start);
            }
            active.edgeIndex += edgeLength;
            active.length -= edgeLength;
            active.node = edge.child;
            stats.recordWalkDown();
            return true;
        }

        /**
         * Split edge after active.length characters. The head keeps the
         * edge's slot and ends at a new internal node; the old edge is
         * shortened and re-keyed under that node next to a new leaf for i.
         */
        private void split(Edge edge, int slot, int i) {
            Node internal = new Node(alphabet.length(), false);

            EndRef splitEnd = EndRef.fixed(edge.start + active.length - 1);
            active.node.putEdge(slot, Edge.internal(edge.start, splitEnd, internal));

            // Start must move before the new slot is computed.
            edge.start += active.length;
            internal.putEdge(alphabet.index(text[edge.start]), edge);

            internal.putEdge(alphabet.index(text[i]), Edge.leaf(i, leafEnd, i - remainder + 1));
            stats.recordSplit();
            stats.recordLeaf();

            if (lastNewInternalNode != null) {
                lastNewInternalNode.linkTo(internal);
            }
            lastNewInternalNode = internal;
        }

        private void linkPendingTo(Node target) {
            if (lastNewInternalNode != null) {
                lastNewInternalNode.linkTo(target);
                lastNewInternalNode = null;
            }
        }

        private void followSuffixLink() {
            Node link = active.node.suffixLink;
            if (link == null) {
                throw new IllegalStateException("suffix link read before it was set");
            }
            if (active.node != root) {
                stats.recordSuffixLinkHop();
            }
            active.node = link;
        }
    }
}
