package datagenerators;

import org.junit.jupiter.api.Test;
import tree.ukkonen.Alphabet;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorTest {

    private static void assertContentOnly(String text, Alphabet alphabet) {
        for (int i = 0; i < text.length(); i++) {
            assertTrue(alphabet.isContent(text.charAt(i)), "offset " + i + " of " + text);
        }
    }

    @Test
    void uniform_is_reproducible_and_never_emits_terminator() {
        String a = Generator.generateUniform(500, Alphabet.PRINTABLE, 7);
        String b = Generator.generateUniform(500, Alphabet.PRINTABLE, 7);

        assertEquals(500, a.length());
        assertEquals(a, b);
        assertContentOnly(a, Alphabet.PRINTABLE);
        assertNotEquals(a, Generator.generateUniform(500, Alphabet.PRINTABLE, 8));
    }

    @Test
    void uniform_with_symbol_count_uses_first_content_characters() {
        String text = Generator.generateUniform(300, Alphabet.PRINTABLE, 2, 3);

        assertTrue(text.chars().allMatch(c -> c == '%' || c == '&'), text);
        assertThrows(IllegalArgumentException.class,
                () -> Generator.generateUniform(10, Alphabet.PRINTABLE, 0, 3));
        assertThrows(IllegalArgumentException.class,
                () -> Generator.generateUniform(10, Alphabet.PRINTABLE, 91, 3));
    }

    @Test
    void zipf_stays_in_content_range() {
        Alphabet alphabet = Alphabet.of('a', 'z');
        String text = Generator.generateZipf(400, alphabet, 1.5, 11);

        assertEquals(400, text.length());
        assertContentOnly(text, alphabet);
        assertEquals(text, Generator.generateZipf(400, alphabet, 1.5, 11));
        assertThrows(IllegalArgumentException.class, () -> Generator.generateZipf(10, alphabet, 0, 1));
    }

    @Test
    void repeats_are_periodic() {
        String text = Generator.generateRepeats(50, 4, Alphabet.PRINTABLE, 5);

        assertEquals(50, text.length());
        for (int i = 4; i < text.length(); i++) {
            assertEquals(text.charAt(i - 4), text.charAt(i));
        }
        assertEquals("", Generator.generateRepeats(0, 4, Alphabet.PRINTABLE, 5));
    }

    @Test
    void negative_length_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Generator.generateUniform(-1, Alphabet.PRINTABLE, 1));
    }
}
