package search;

/**
 * Result of one scan pass. When {@code aborted} is set the pass stopped at the first
 * match longer than twice the search length, {@code maxMatch} is that match's length and the
 * candidate buffer must not be tiled.
 */
public record ScanOutcome(int maxMatch, boolean aborted, int indexedWindows) {

    public static ScanOutcome completed(int maxMatch, int indexedWindows) {
        return new ScanOutcome(maxMatch, false, indexedWindows);
    }

    public static ScanOutcome abortedAt(int matchLength, int indexedWindows) {
        return new ScanOutcome(matchLength, true, indexedWindows);
    }
}
