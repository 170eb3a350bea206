package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayDeque;

/**
 * Reads the suffix array off a finished suffix tree.
 *
 * Edges are visited depth first in slot order, which is alphabet order, so the
 * leaves come out sorted by the suffixes they end. The walk keeps its own stack
 * instead of recursing; a tree for a long repetitive text can be as deep as the
 * text is long.
 */
public final class SuffixArrayExtractor {

    private SuffixArrayExtractor() {
    }

    public static int[] extract(SuffixTreeUkkonen tree) {
        int n = tree.getOriginalLength() + 1;
        IntArrayList out = new IntArrayList(n);
        collectLeaves(tree.getRoot(), out);
        if (out.size() != n) {
            throw new IllegalStateException("suffix tree yielded " + out.size()
                    + " leaves for a text of length " + n);
        }
        return out.toIntArray();
    }

    // Append the suffix ids of every leaf below node, in alphabet order.
    public static void collectLeaves(SuffixTreeUkkonen.Node node, IntArrayList out) {
        ArrayDeque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(node));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            SuffixTreeUkkonen.Node current = frame.node;

            // Advance to the next occupied slot
            SuffixTreeUkkonen.Edge edge = null;
            while (frame.nextSlot < current.slotCount() && edge == null) {
                edge = current.getEdge(frame.nextSlot++);
            }
            if (edge == null) {
                stack.pop();
                continue;
            }

            edge.checkShape();
            if (edge.isLeaf()) {
                out.add(edge.getSuffixId());
            } else {
                // Finish the whole subtree before the next slot of this node.
                stack.push(new Frame(edge.getChild()));
            }
        }
    }

    private static final class Frame {
        final SuffixTreeUkkonen.Node node;
        int nextSlot;

        Frame(SuffixTreeUkkonen.Node node) {
            this.node = node;
        }
    }
}
