package utilities;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BenchmarkOptionsTest {

    @Test
    public void defaults() {
        BenchmarkOptions options = BenchmarkOptions.defaults();
        assertEquals(20, options.initialSearchLength());
        assertEquals(5, options.minimumMatchLength());
        assertEquals(3, options.runs());
        assertFalse(options.runBaseline());
    }

    @Test
    public void parsesBothOptionForms() {
        BenchmarkOptions options = BenchmarkOptions.parse(new String[]{
                "--pattern-length=100", "--text-length", "200", "--zipf=1.1", "--seed", "7",
                "--initial=12", "--min", "3", "--baseline", "--stats=true"});
        assertEquals(100, options.patternLength());
        assertEquals(200, options.textLength());
        assertEquals(1.1, options.zipfExponent(), 1e-9);
        assertEquals(7L, options.seed());
        assertEquals(12, options.initialSearchLength());
        assertEquals(3, options.minimumMatchLength());
        assertTrue(options.runBaseline());
        assertTrue(options.collectStats());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownOption() {
        BenchmarkOptions.parse(new String[]{"--window=3"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMissingValue() {
        BenchmarkOptions.parse(new String[]{"--runs"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZeroRuns() {
        BenchmarkOptions.parse(new String[]{"--runs=0"});
    }
}
