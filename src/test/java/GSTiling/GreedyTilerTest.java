package GSTiling;

import org.junit.Test;
import search.Match;
import utilities.MarkArray;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GreedyTilerTest {

    @Test
    public void longestCandidateWinsConflicts() {
        MarkArray pm = new MarkArray(20);
        MarkArray tm = new MarkArray(20);
        List<Match> candidates = new ArrayList<>(List.of(
                new Match(0, 0, 3),
                new Match(1, 5, 5),
                new Match(4, 10, 3)));
        List<Match> result = new ArrayList<>();

        int accepted = GreedyTiler.tile(candidates, pm, tm, result);

        assertEquals(1, accepted);
        assertEquals(List.of(new Match(1, 5, 5)), result);
        assertTrue(candidates.isEmpty());
        assertEquals(5, pm.markedCount());
        assertEquals(5, tm.markedCount());
        assertTrue(pm.isMarked(1) && pm.isMarked(5) && !pm.isMarked(6));
        assertTrue(tm.isMarked(5) && tm.isMarked(9) && !tm.isMarked(10));
    }

    @Test
    public void equalLengthsKeepDiscoveryOrder() {
        MarkArray pm = new MarkArray(10);
        MarkArray tm = new MarkArray(10);
        List<Match> candidates = new ArrayList<>(List.of(
                new Match(2, 0, 2),
                new Match(0, 2, 2),
                new Match(0, 6, 2)));
        List<Match> result = new ArrayList<>();

        GreedyTiler.tile(candidates, pm, tm, result);

        assertEquals(List.of(new Match(2, 0, 2), new Match(0, 2, 2)), result);
    }

    @Test
    public void partiallyMarkedCandidateIsRejectedWhole() {
        MarkArray pm = new MarkArray(10);
        MarkArray tm = new MarkArray(10);
        tm.mark(7, 1);
        List<Match> candidates = new ArrayList<>(List.of(new Match(0, 5, 4)));
        List<Match> result = new ArrayList<>();

        assertEquals(0, GreedyTiler.tile(candidates, pm, tm, result));
        assertTrue(result.isEmpty());
        assertEquals(0, pm.markedCount());
        assertEquals(1, tm.markedCount());
        assertFalse(tm.isMarked(5));
    }

    @Test
    public void appendsAfterExistingTiles() {
        MarkArray pm = new MarkArray(10);
        MarkArray tm = new MarkArray(10);
        List<Match> result = new ArrayList<>(List.of(new Match(0, 0, 3)));
        pm.mark(0, 3);
        tm.mark(0, 3);
        List<Match> candidates = new ArrayList<>(List.of(new Match(2, 4, 3), new Match(5, 5, 2)));

        GreedyTiler.tile(candidates, pm, tm, result);

        assertEquals(List.of(new Match(0, 0, 3), new Match(5, 5, 2)), result);
    }
}
