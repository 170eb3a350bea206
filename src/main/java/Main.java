import datagenerators.Generator;
import tree.ukkonen.Alphabet;
import tree.ukkonen.AlphabetViolationException;
import tree.ukkonen.SuffixArrays;
import tree.ukkonen.SuffixTreeConfiguration;
import tree.ukkonen.SuffixTreeUkkonen;
import utilities.SuffixTreeLogger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line driver: builds a suffix tree for each text argument (or for a
 * generated text) and prints the suffix array read off it.
 *
 * <pre>
 *   Main banana                      banana -> [6, 5, 3, 1, 0, 4, 2]
 *   Main --random 1000 --seed 7 --stats
 *   Main --find ana --lcp banana
 * </pre>
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_BAD_INPUT = 1;
    static final int EXIT_USAGE = 2;

    private static final int DEFAULT_SEED = 42;
    private static final int MAX_PRINTED_TEXT = 60;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }

        SuffixTreeConfiguration config = SuffixTreeConfiguration.builder()
                .alphabetStart(options.alphabetStart)
                .alphabetEnd(options.alphabetEnd)
                .collectStats(options.stats)
                .build();

        List<String> texts = new ArrayList<>(options.texts);
        if (options.randomLength >= 0) {
            Alphabet alphabet = config.alphabet();
            texts.add(options.zipfExponent > 0
                    ? Generator.generateZipf(options.randomLength, alphabet, options.zipfExponent, options.seed)
                    : Generator.generateUniform(options.randomLength, alphabet, options.seed));
        }
        if (texts.isEmpty()) {
            err.println(usage());
            return EXIT_USAGE;
        }

        int exit = EXIT_OK;
        for (String text : texts) {
            SuffixTreeUkkonen tree;
            try {
                tree = SuffixTreeUkkonen.build(text, config);
            } catch (AlphabetViolationException e) {
                err.println(abbreviate(text) + ": " + e.getMessage());
                exit = EXIT_BAD_INPUT;
                continue;
            }

            int[] sa = tree.toSuffixArray();
            out.println(abbreviate(text) + " -> " + Arrays.toString(sa));
            if (options.lcp) {
                out.println("  lcp: " + Arrays.toString(SuffixArrays.buildLcpArray(tree.getText(), sa)));
            }
            for (String pattern : options.patterns) {
                out.println("  find " + pattern + ": " + tree.findOccurrences(pattern));
            }
            if (options.stats) {
                out.println("  " + tree.getStats());
                SuffixTreeLogger.info("stats for text of length " + text.length() + ": " + tree.getStats());
            }
        }
        return exit;
    }

    private static String abbreviate(String text) {
        if (text.length() <= MAX_PRINTED_TEXT) {
            return text;
        }
        return text.substring(0, MAX_PRINTED_TEXT) + "...(" + text.length() + " chars)";
    }

    static String usage() {
        return "usage: Main [--start N] [--end N] [--random LEN [--zipf EXP] [--seed N]]"
                + " [--find PATTERN]... [--lcp] [--stats] [text...]";
    }

    private static final class CliOptions {
        final int alphabetStart;
        final int alphabetEnd;
        final int randomLength;
        final double zipfExponent;
        final long seed;
        final boolean stats;
        final boolean lcp;
        final List<String> patterns;
        final List<String> texts;

        private CliOptions(int alphabetStart,
                           int alphabetEnd,
                           int randomLength,
                           double zipfExponent,
                           long seed,
                           boolean stats,
                           boolean lcp,
                           List<String> patterns,
                           List<String> texts) {
            this.alphabetStart = alphabetStart;
            this.alphabetEnd = alphabetEnd;
            this.randomLength = randomLength;
            this.zipfExponent = zipfExponent;
            this.seed = seed;
            this.stats = stats;
            this.lcp = lcp;
            this.patterns = patterns;
            this.texts = texts;
        }

        static CliOptions parse(String[] args) {
            int start = Alphabet.DEFAULT_START;
            int end = Alphabet.DEFAULT_END;
            int random = -1;
            double zipf = 0;
            long seed = DEFAULT_SEED;
            boolean stats = false;
            boolean lcp = false;
            List<String> patterns = new ArrayList<>();
            List<String> texts = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    texts.add(arg);
                    continue;
                }
                String key;
                String value = null;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                }
                switch (key) {
                    case "stats" -> stats = true;
                    case "lcp" -> lcp = true;
                    default -> {
                        if (value == null) {
                            if (i + 1 >= args.length) {
                                throw new IllegalArgumentException("Missing value for option --" + key);
                            }
                            value = args[++i];
                        }
                        try {
                            switch (key) {
                                case "start" -> start = Integer.parseInt(value);
                                case "end" -> end = Integer.parseInt(value);
                                case "random" -> random = Integer.parseInt(value);
                                case "zipf" -> zipf = Double.parseDouble(value);
                                case "seed" -> seed = Long.parseLong(value);
                                case "find" -> patterns.add(value);
                                default -> throw new IllegalArgumentException("Unknown option --" + key);
                            }
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Bad number for option --" + key + ": " + value, e);
                        }
                    }
                }
            }

            // Fails here rather than at build time for a bad range.
            Alphabet.of(start, end);
            return new CliOptions(start, end, random, zipf, seed, stats, lcp, patterns, texts);
        }
    }
}
