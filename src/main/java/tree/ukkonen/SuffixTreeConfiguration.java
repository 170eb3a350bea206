package tree.ukkonen;

// Immutable configuration for building suffix trees.
public final class SuffixTreeConfiguration {

    private static final SuffixTreeConfiguration DEFAULTS = builder().build();

    private final Alphabet alphabet;
    private final boolean collectStats;
    private final boolean verifyInvariants;

    private SuffixTreeConfiguration(Builder builder) {
        this.alphabet = Alphabet.of(builder.alphabetStart, builder.alphabetEnd);
        this.collectStats = builder.collectStats;
        this.verifyInvariants = builder.verifyInvariants;
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return DEFAULTS; }

    public Alphabet alphabet() { return alphabet; }
    public boolean collectStats() { return collectStats; }
    public boolean verifyInvariants() { return verifyInvariants; }

    public Builder toBuilder() {
        return builder()
                .alphabetStart(alphabet.start())
                .alphabetEnd(alphabet.end())
                .collectStats(collectStats)
                .verifyInvariants(verifyInvariants);
    }

    @Override
    public String toString() {
        return "SuffixTreeConfiguration{" +
                "alphabet=" + alphabet +
                ", collectStats=" + collectStats +
                ", verifyInvariants=" + verifyInvariants +
                '}';
    }

    public static final class Builder {
        private int alphabetStart = Alphabet.DEFAULT_START;
        private int alphabetEnd = Alphabet.DEFAULT_END;
        private boolean collectStats;
        private boolean verifyInvariants;

        private Builder() {
        }

        // The character at alphabetStart becomes the terminator.
        public Builder alphabetStart(int alphabetStart) {
            this.alphabetStart = alphabetStart;
            return this;
        }

        public Builder alphabetEnd(int alphabetEnd) {
            this.alphabetEnd = alphabetEnd;
            return this;
        }

        public Builder alphabet(Alphabet alphabet) {
            this.alphabetStart = alphabet.start();
            this.alphabetEnd = alphabet.end();
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public Builder verifyInvariants(boolean verifyInvariants) {
            this.verifyInvariants = verifyInvariants;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
