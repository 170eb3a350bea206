package tree.ukkonen;

import utilities.SuffixTreeLogger;

/**
 * Fixed contiguous code-point range addressed directly by a node's edge table.
 *
 * The lowest character of the range is reserved as the terminator, so it sorts
 * before every content character. Content characters are (start, end].
 */
public final class Alphabet {

    public static final int DEFAULT_START = 36;   // '$'
    public static final int DEFAULT_END = 126;    // '~'

    public static final Alphabet PRINTABLE = new Alphabet(DEFAULT_START, DEFAULT_END);

    private final int start;
    private final int end;

    private Alphabet(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public static Alphabet of(int start, int end) {
        if (start < Character.MIN_VALUE || end > Character.MAX_VALUE) {
            throw new IllegalArgumentException("alphabet range must lie within [0, 0xFFFF]");
        }
        if (start >= end) {
            throw new IllegalArgumentException("alphabet start must be smaller than end, got ["
                    + start + ", " + end + "]");
        }
        if (start == DEFAULT_START && end == DEFAULT_END) {
            return PRINTABLE;
        }
        return new Alphabet(start, end);
    }

    public int start() { return start; }

    public int end() { return end; }

    // Number of edge slots per node, terminator included.
    public int length() {
        return end - start + 1;
    }

    public char terminator() {
        return (char) start;
    }

    public boolean contains(char c) {
        return c >= start && c <= end;
    }

    public boolean isContent(char c) {
        return c > start && c <= end;
    }

    public int index(char c) {
        if (!contains(c)) {
            throw new AlphabetViolationException(c, -1, this);
        }
        return c - start;
    }

    /**
     * Fails on the first character that is outside the content range, the
     * terminator included. Nothing is built before this check passes.
     * Reporting the failure is left to the caller.
     */
    public void validate(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isContent(c)) {
                AlphabetViolationException ex = new AlphabetViolationException(c, i, this);
                SuffixTreeLogger.debug(ex.getMessage());
                throw ex;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet)) return false;
        Alphabet other = (Alphabet) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "Alphabet[" + start + ", " + end + "]";
    }
}
