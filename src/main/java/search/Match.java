package search;

import java.util.Comparator;

/**
 * One tile: {@code pattern[patternIndex .. patternIndex+length)} equals
 * {@code text[textIndex .. textIndex+length)}.
 */
public record Match(int patternIndex, int textIndex, int length) implements Comparable<Match> {

    private static final Comparator<Match> ORDER = Comparator
            .comparingInt(Match::patternIndex)
            .thenComparingInt(Match::textIndex)
            .thenComparingInt(Match::length);

    public Match {
        if (patternIndex < 0) {
            throw new IllegalArgumentException("patternIndex must be >= 0");
        }
        if (textIndex < 0) {
            throw new IllegalArgumentException("textIndex must be >= 0");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
    }

    // Exclusive end of the pattern span.
    public int patternEnd() { return patternIndex + length; }

    // Exclusive end of the text span.
    public int textEnd() { return textIndex + length; }

    @Override
    public int compareTo(Match other) {
        return ORDER.compare(this, other);
    }
}
