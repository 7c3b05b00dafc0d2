package search;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class MatchTest {

    @Test
    public void ordersByPatternThenTextThenLength() {
        List<Match> matches = new ArrayList<>(List.of(
                new Match(2, 0, 3),
                new Match(1, 5, 2),
                new Match(1, 5, 1),
                new Match(1, 4, 9)));
        Collections.sort(matches);
        assertEquals(List.of(
                new Match(1, 4, 9),
                new Match(1, 5, 1),
                new Match(1, 5, 2),
                new Match(2, 0, 3)), matches);
    }

    @Test
    public void endsAreExclusive() {
        Match m = new Match(3, 7, 4);
        assertEquals(7, m.patternEnd());
        assertEquals(11, m.textEnd());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZeroLength() {
        new Match(0, 0, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeOffset() {
        new Match(-1, 0, 2);
    }
}
