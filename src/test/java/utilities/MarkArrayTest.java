package utilities;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MarkArrayTest {

    @Test
    public void startsUnmarked() {
        MarkArray marks = new MarkArray(5);
        assertEquals(5, marks.size());
        assertEquals(0, marks.markedCount());
        assertTrue(marks.isRangeUnmarked(0, 5));
        assertEquals(-1, marks.nextMarked(0));
        assertEquals(".....", marks.toString());
    }

    @Test
    public void markingIsMonotonic() {
        MarkArray marks = new MarkArray(8);
        marks.mark(2, 3);
        marks.mark(3, 1);
        marks.mark(0, 0);
        assertEquals(3, marks.markedCount());
        assertEquals("..###...", marks.toString());
        assertTrue(marks.isMarked(4));
        assertFalse(marks.isMarked(5));
    }

    @Test
    public void rangeQueries() {
        MarkArray marks = new MarkArray(10);
        marks.mark(6, 1);
        assertTrue(marks.isRangeUnmarked(0, 6));
        assertFalse(marks.isRangeUnmarked(5, 2));
        assertTrue(marks.isRangeUnmarked(7, 3));
        assertTrue(marks.isRangeUnmarked(10, 0));
        assertEquals(6, marks.nextMarked(0));
        assertEquals(6, marks.nextMarked(6));
        assertEquals(-1, marks.nextMarked(7));
        assertEquals(-1, marks.nextMarked(42));
    }

    @Test
    public void emptyArray() {
        MarkArray marks = new MarkArray(0);
        assertTrue(marks.isRangeUnmarked(0, 0));
        assertEquals(-1, marks.nextMarked(0));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectsRangePastEnd() {
        new MarkArray(4).mark(2, 3);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectsNegativeIndex() {
        new MarkArray(4).isMarked(-1);
    }
}
