package tree.ukkonen;

// Thrown when a character cannot be placed in the suffix tree's alphabet.
public class AlphabetViolationException extends IllegalArgumentException {

    private final char character;
    private final int offset;

    public AlphabetViolationException(char character, int offset, Alphabet alphabet) {
        super(describe(character, offset, alphabet));
        this.character = character;
        this.offset = offset;
    }

    private static String describe(char c, int offset, Alphabet alphabet) {
        String where = offset >= 0 ? " at offset " + offset : "";
        if (c == alphabet.terminator()) {
            return "reserved terminator '" + c + "'" + where + " is not allowed in the text";
        }
        return "character U+" + String.format("%04X", (int) c) + where
                + " is outside " + alphabet;
    }

    public char getCharacter() {
        return character;
    }

    // -1 when the character was not looked up as part of a text.
    public int getOffset() {
        return offset;
    }
}
