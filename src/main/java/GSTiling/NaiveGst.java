package GSTiling;

import search.CandidateScanner;
import search.Match;
import utilities.MarkArray;
import utilities.TokenSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

// Plain Greedy-String-Tiling (Wise): every iteration compares all unmarked pattern/text pairs,
// keeps the matches of maximal length and tiles the unoccluded ones. Baseline for RkrGst.
public final class NaiveGst implements IStringTiling {

    private final int minimumMatchLength;

    public NaiveGst(int minimumMatchLength) {
        if (minimumMatchLength <= 0) {
            throw new IllegalArgumentException("minimumMatchLength must be positive");
        }
        this.minimumMatchLength = minimumMatchLength;
    }

    @Override
    public int minimumMatchLength() {
        return minimumMatchLength;
    }

    @Override
    public List<Match> tile(TokenSequence pattern, TokenSequence text) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(text, "text");
        MarkArray patternMarks = new MarkArray(pattern.length());
        MarkArray textMarks = new MarkArray(text.length());
        List<Match> result = new ArrayList<>();
        List<Match> maximal = new ArrayList<>();

        int maxMatch;
        do {
            maxMatch = minimumMatchLength;
            maximal.clear();
            for (int p = 0; p + maxMatch <= pattern.length(); p++) {
                if (patternMarks.isMarked(p)) {
                    continue;
                }
                for (int t = 0; t + maxMatch <= text.length(); t++) {
                    if (textMarks.isMarked(t)) {
                        continue;
                    }
                    int k = CandidateScanner.extend(pattern, patternMarks, p, text, textMarks, t);
                    if (k < maxMatch) {
                        continue;
                    }
                    if (k > maxMatch) {
                        maximal.clear();
                        maxMatch = k;
                    }
                    maximal.add(new Match(p, t, k));
                }
            }
            GreedyTiler.tile(maximal, patternMarks, textMarks, result);
        } while (maxMatch > minimumMatchLength);

        return result;
    }
}
