package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hand-assembled trees for "ab$" that break one structural rule each.
 */
class TreeInvariantFaultTest {

    private static final Alphabet ALPHABET = Alphabet.PRINTABLE;
    private static final char[] TEXT = {'a', 'b', '$'};

    private static int slot(char c) {
        return ALPHABET.index(c);
    }

    private static SuffixTreeUkkonen.EndRef end() {
        SuffixTreeUkkonen.EndRef end = SuffixTreeUkkonen.EndRef.shared();
        end.advance(TEXT.length - 1);
        return end;
    }

    private static SuffixTreeUkkonen tree(SuffixTreeUkkonen.Node root) {
        return new SuffixTreeUkkonen(root, TEXT, TEXT.length - 1, ALPHABET, new BuildStats(false));
    }

    private static SuffixTreeUkkonen.Node wellFormedRoot() {
        SuffixTreeUkkonen.EndRef end = end();
        SuffixTreeUkkonen.Node root = SuffixTreeUkkonen.Node.root(ALPHABET.length());
        root.putEdge(slot('a'), SuffixTreeUkkonen.Edge.leaf(0, end, 0));
        root.putEdge(slot('b'), SuffixTreeUkkonen.Edge.leaf(1, end, 1));
        root.putEdge(slot('$'), SuffixTreeUkkonen.Edge.leaf(2, end, 2));
        return root;
    }

    @Test
    void well_formed_tree_passes() {
        SuffixTreeUkkonen tree = tree(wellFormedRoot());

        tree.verifyInvariants();
        assertArrayEquals(new int[]{2, 0, 1}, tree.toSuffixArray());
    }

    @Test
    void suffix_link_cannot_be_set_twice() {
        SuffixTreeUkkonen.Node root = SuffixTreeUkkonen.Node.root(ALPHABET.length());
        SuffixTreeUkkonen.Node node = new SuffixTreeUkkonen.Node(ALPHABET.length(), false);
        node.linkTo(root);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> node.linkTo(root));
        assertTrue(ex.getMessage().contains("already set"));
        assertThrows(IllegalStateException.class, () -> root.linkTo(root));
    }

    @Test
    void internal_node_without_suffix_link_fails() {
        SuffixTreeUkkonen.EndRef end = end();
        SuffixTreeUkkonen.Node root = wellFormedRoot();
        SuffixTreeUkkonen.Node unlinked = new SuffixTreeUkkonen.Node(ALPHABET.length(), false);
        unlinked.putEdge(slot('b'), SuffixTreeUkkonen.Edge.leaf(1, end, 0));
        unlinked.putEdge(slot('$'), SuffixTreeUkkonen.Edge.leaf(2, end, 1));
        root.putEdge(slot('a'), SuffixTreeUkkonen.Edge.internal(0, SuffixTreeUkkonen.EndRef.fixed(0), unlinked));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> tree(root).verifyInvariants());
        assertTrue(ex.getMessage().contains("suffix link"));
    }

    @Test
    void internal_node_with_single_edge_fails() {
        SuffixTreeUkkonen.Node root = wellFormedRoot();
        SuffixTreeUkkonen.Node lonely = new SuffixTreeUkkonen.Node(ALPHABET.length(), false);
        lonely.linkTo(root);
        lonely.putEdge(slot('b'), SuffixTreeUkkonen.Edge.leaf(1, end(), 0));
        root.putEdge(slot('a'), SuffixTreeUkkonen.Edge.internal(0, SuffixTreeUkkonen.EndRef.fixed(0), lonely));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> tree(root).verifyInvariants());
        assertTrue(ex.getMessage().contains("1 outgoing"));
    }

    @Test
    void missing_leaf_fails() {
        SuffixTreeUkkonen.Node root = wellFormedRoot();
        root.putEdge(slot('b'), null);
        SuffixTreeUkkonen tree = tree(root);

        IllegalStateException ex = assertThrows(IllegalStateException.class, tree::verifyInvariants);
        assertTrue(ex.getMessage().contains("expected 3 leaves but found 2"));
        assertThrows(IllegalStateException.class, tree::toSuffixArray);
    }

    @Test
    void edge_with_child_and_suffix_id_fails() {
        SuffixTreeUkkonen.Node root = wellFormedRoot();
        SuffixTreeUkkonen.Node child = new SuffixTreeUkkonen.Node(ALPHABET.length(), false);
        root.putEdge(slot('a'), new SuffixTreeUkkonen.Edge(0, SuffixTreeUkkonen.EndRef.fixed(0), child, 0));
        SuffixTreeUkkonen tree = tree(root);

        IllegalStateException ex = assertThrows(IllegalStateException.class, tree::verifyInvariants);
        assertTrue(ex.getMessage().contains("either a child or a suffix id"));
        assertThrows(IllegalStateException.class,
                () -> SuffixArrayExtractor.collectLeaves(root, new IntArrayList()));
    }

    @Test
    void edge_with_neither_child_nor_suffix_id_fails() {
        SuffixTreeUkkonen.Node root = wellFormedRoot();
        root.putEdge(slot('b'), new SuffixTreeUkkonen.Edge(1, end(), null, -1));

        assertThrows(IllegalStateException.class, () -> tree(root).verifyInvariants());
    }

    @Test
    void empty_edge_fails() {
        SuffixTreeUkkonen.Node root = wellFormedRoot();
        root.putEdge(slot('b'), SuffixTreeUkkonen.Edge.leaf(2, SuffixTreeUkkonen.EndRef.fixed(1), 1));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> tree(root).verifyInvariants());
        assertTrue(ex.getMessage().contains("has length 0"));
    }
}
