package search;

import hashing.RollingChecksum;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.MarkArray;
import utilities.TokenSequence;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One scan pass of RKR-GST: index the unmarked text windows, walk the unmarked pattern
 * windows with the same checksum and turn every verified hit into a maximal forward match.
 * Bound to the sequences and marks of a single run.
 */
public final class CandidateScanner {

    private final TokenSequence pattern;
    private final TokenSequence text;
    private final MarkArray patternMarks;
    private final MarkArray textMarks;
    private final Supplier<RollingChecksum> checksums;

    // per-pass state read by the window visitor
    private List<Match> sink;
    private TextHashIndex index;
    private int searchLength;
    private int maxMatch;
    private int abortLength;

    public CandidateScanner(TokenSequence pattern,
                            MarkArray patternMarks,
                            TokenSequence text,
                            MarkArray textMarks,
                            Supplier<RollingChecksum> checksums) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.text = Objects.requireNonNull(text, "text");
        this.patternMarks = Objects.requireNonNull(patternMarks, "patternMarks");
        this.textMarks = Objects.requireNonNull(textMarks, "textMarks");
        this.checksums = Objects.requireNonNull(checksums, "checksums");
        if (patternMarks.size() != pattern.length()) {
            throw new IllegalArgumentException("pattern marks do not match the pattern length");
        }
        if (textMarks.size() != text.length()) {
            throw new IllegalArgumentException("text marks do not match the text length");
        }
    }

    /**
     * Clears {@code candidates} and refills it with every match of length >= {@code s}.
     * Stops early, leaving the buffer incomplete, as soon as a match longer than {@code 2*s} is seen.
     */
    public ScanOutcome scan(int s, List<Match> candidates) {
        if (s <= 0) {
            throw new IllegalArgumentException("search length must be positive");
        }
        candidates.clear();
        if (pattern.length() < s || text.length() < s) {
            return ScanOutcome.completed(0, 0);
        }

        this.index = TextHashIndex.build(text, textMarks, s, checksums.get());
        this.sink = candidates;
        this.searchLength = s;
        this.maxMatch = 0;
        this.abortLength = 0;
        try {
            if (index.windowCount() > 0) {
                UnmarkedWindowWalker.walk(pattern.rawTokens(), patternMarks, s, checksums.get(), this::probe);
            }
            if (abortLength > 0) {
                return ScanOutcome.abortedAt(abortLength, index.windowCount());
            }
            return ScanOutcome.completed(maxMatch, index.windowCount());
        } finally {
            this.sink = null;
            this.index = null;
        }
    }

    private boolean probe(int patternIndex, int hash) {
        IntList offsets = index.offsets(hash);
        if (offsets == null) {
            return true;
        }
        for (int j = 0, n = offsets.size(); j < n; j++) {
            int textIndex = offsets.getInt(j);
            int k = extend(pattern, patternMarks, patternIndex, text, textMarks, textIndex);
            if (k > 2L * searchLength) {
                abortLength = k;
                return false;
            }
            if (k >= searchLength) {
                sink.add(new Match(patternIndex, textIndex, k));
                maxMatch = Math.max(maxMatch, k);
            }
        }
        return true;
    }

    /**
     * Length of the common run starting at {@code patternIndex}/{@code textIndex}, walking forward while
     * tokens are equal and neither side is marked.
     */
    public static int extend(TokenSequence pattern, MarkArray patternMarks, int patternIndex,
                             TokenSequence text, MarkArray textMarks, int textIndex) {
        int[] p = pattern.rawTokens();
        int[] t = text.rawTokens();
        int k = 0;
        while (patternIndex + k < p.length
                && textIndex + k < t.length
                && p[patternIndex + k] == t[textIndex + k]
                && !patternMarks.isMarked(patternIndex + k)
                && !textMarks.isMarked(textIndex + k)) {
            k++;
        }
        return k;
    }
}
