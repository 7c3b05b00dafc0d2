package GSTiling;

import search.Match;
import utilities.MarkArray;

import java.util.Comparator;
import java.util.List;

/**
 * Turns the candidates of one scan pass into tiles: longest first, each accepted only if its
 * whole span is still unmarked on both sides, then marked.
 */
public final class GreedyTiler {

    // List.sort is stable, so equal lengths keep discovery order (pattern offset, then text offset).
    static final Comparator<Match> LONGEST_FIRST = (a, b) -> Integer.compare(b.length(), a.length());

    private GreedyTiler() {
    }

    /**
     * Consumes {@code candidates} (the list is empty afterwards).
     *
     * @return number of candidates accepted and appended to {@code result}
     */
    public static int tile(List<Match> candidates, MarkArray patternMarks, MarkArray textMarks, List<Match> result) {
        candidates.sort(LONGEST_FIRST);
        int accepted = 0;
        for (Match m : candidates) {
            if (!patternMarks.isRangeUnmarked(m.patternIndex(), m.length())
                    || !textMarks.isRangeUnmarked(m.textIndex(), m.length())) {
                continue;
            }
            result.add(m);
            patternMarks.mark(m.patternIndex(), m.length());
            textMarks.mark(m.textIndex(), m.length());
            accepted++;
        }
        candidates.clear();
        return accepted;
    }
}
