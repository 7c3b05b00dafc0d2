package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import utilities.TokenSequence;

// Seeded synthetic token sequences for benchmarks and randomized tests.
public final class SequenceGenerator {

    private SequenceGenerator() {
    }

    // Tokens drawn uniformly from [0, alphabetSize).
    public static TokenSequence generateUniform(int length, int alphabetSize, long seed) {
        checkArgs(length, alphabetSize);
        RandomGenerator rng = new Well19937c(seed);
        int[] tokens = new int[length];
        for (int i = 0; i < length; i++) {
            tokens[i] = rng.nextInt(alphabetSize);
        }
        return TokenSequence.of(tokens);
    }

    public static TokenSequence generateZipf(int length, int alphabetSize, double exponent, long seed) {
        checkArgs(length, alphabetSize);
        if (exponent <= 0) {
            throw new IllegalArgumentException("exponent must be positive");
        }
        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);
        int[] tokens = new int[length];
        for (int i = 0; i < length; i++) {
            tokens[i] = dist.sample() - 1;
        }
        return TokenSequence.of(tokens);
    }

    /**
     * Derives a text from {@code source} by copying random blocks of it, each followed by a few fresh
     * tokens, until {@code length} tokens are produced. The result shares many long substrings with the
     * source, which is the interesting case for tiling.
     */
    public static TokenSequence mutate(TokenSequence source, int length, int maxBlock, int alphabetSize, long seed) {
        checkArgs(length, alphabetSize);
        if (maxBlock <= 0) {
            throw new IllegalArgumentException("maxBlock must be positive");
        }
        RandomGenerator rng = new Well19937c(seed);
        int[] out = new int[length];
        int produced = 0;
        while (produced < length) {
            if (!source.isEmpty()) {
                int block = 1 + rng.nextInt(maxBlock);
                int from = rng.nextInt(source.length());
                for (int i = 0; i < block && from + i < source.length() && produced < length; i++) {
                    out[produced++] = source.tokenAt(from + i);
                }
            }
            int noise = 1 + rng.nextInt(3);
            for (int i = 0; i < noise && produced < length; i++) {
                out[produced++] = rng.nextInt(alphabetSize);
            }
        }
        return TokenSequence.of(out);
    }

    private static void checkArgs(int length, int alphabetSize) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabetSize must be positive");
        }
    }
}
