package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import tree.ukkonen.Alphabet;

/**
 * Seeded text generators over the content characters of an {@link Alphabet}.
 * The terminator is never produced, so every result can be fed straight to
 * the suffix tree builder.
 */
public class Generator {

    public static String generateUniform(int length, Alphabet alphabet, long seed) {
        return generateUniform(length, alphabet, alphabet.length() - 1, seed);
    }

    // Draws from the first symbolCount content characters only.
    public static String generateUniform(int length, Alphabet alphabet, int symbolCount, long seed) {
        checkLength(length);
        checkSymbolCount(alphabet, symbolCount);

        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = contentChar(alphabet, rng.nextInt(symbolCount));
        }
        return new String(chars);
    }

    public static String generateZipf(int length, Alphabet alphabet, double exponent, long seed) {
        checkLength(length);
        if (exponent <= 0) {
            throw new IllegalArgumentException("exponent must be positive");
        }
        int symbolCount = alphabet.length() - 1;

        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);
        // ZipfDistribution samples integers in the closed interval [1, symbolCount]
        ZipfDistribution dist = new ZipfDistribution(rng, symbolCount, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();                 // 1 .. symbolCount
            chars[i] = contentChar(alphabet, rank - 1);
        }
        return new String(chars);
    }

    // Repeats one random block of the given period until length is reached.
    public static String generateRepeats(int length, int period, Alphabet alphabet, long seed) {
        checkLength(length);
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive");
        }
        String block = generateUniform(Math.min(period, Math.max(length, 1)), alphabet, seed);
        StringBuilder sb = new StringBuilder(length);
        while (sb.length() < length) {
            sb.append(block, 0, Math.min(block.length(), length - sb.length()));
        }
        return sb.toString();
    }

    private static char contentChar(Alphabet alphabet, int ordinal) {
        // ordinal 0 is the first character after the terminator
        return (char) (alphabet.start() + 1 + ordinal);
    }

    private static void checkLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
    }

    private static void checkSymbolCount(Alphabet alphabet, int symbolCount) {
        if (symbolCount <= 0 || symbolCount > alphabet.length() - 1) {
            throw new IllegalArgumentException("symbolCount must be in [1, "
                    + (alphabet.length() - 1) + "], got " + symbolCount);
        }
    }
}
