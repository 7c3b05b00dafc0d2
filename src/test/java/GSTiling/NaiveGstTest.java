package GSTiling;

import org.junit.Test;
import search.Match;
import utilities.TokenSequence;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class NaiveGstTest {

    @Test
    public void agreesWithRkrGstOnSimpleScenarios() {
        NaiveGst naive = new NaiveGst(2);
        assertEquals(List.of(new Match(0, 3, 3)),
                naive.tile(TokenSequence.ofString("lower"), TokenSequence.ofString("yellow")));
        assertEquals(List.of(new Match(0, 3, 3), new Match(5, 7, 3)),
                naive.tile(TokenSequence.ofString("lowerlow"), TokenSequence.ofString("yellow lowlow")));
    }

    @Test
    public void tilesLongestFirst() {
        List<Match> tiles = new NaiveGst(2).tile(TokenSequence.ofString("ab--wxyz"), TokenSequence.ofString("wxyz..ab"));
        assertEquals(List.of(new Match(4, 0, 4), new Match(0, 6, 2)), tiles);
    }

    @Test
    public void emptyInputsGiveNoTiles() {
        assertTrue(new NaiveGst(1).tile(TokenSequence.empty(), TokenSequence.ofString("abc")).isEmpty());
        assertTrue(new NaiveGst(1).tile(TokenSequence.ofString("abc"), TokenSequence.empty()).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveMinimum() {
        new NaiveGst(0);
    }
}
