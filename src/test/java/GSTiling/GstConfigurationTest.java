package GSTiling;

import hashing.RollingAdler32;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GstConfigurationTest {

    @Test
    public void defaultsToAdlerWithoutStats() {
        GstConfiguration config = GstConfiguration.of(12, 4);
        assertEquals(12, config.initialSearchLength());
        assertEquals(4, config.minimumMatchLength());
        assertFalse(config.collectStats());
        assertTrue(config.checksumSupplier().get() instanceof RollingAdler32);
    }

    @Test
    public void minimumMayEqualInitialLength() {
        assertEquals(5, GstConfiguration.of(5, 5).minimumMatchLength());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeInitialLength() {
        GstConfiguration.of(-1, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnsetMinimum() {
        GstConfiguration.builder().initialSearchLength(3).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMinimumAboveInitialLength() {
        GstConfiguration.of(4, 9);
    }

    @Test(expected = NullPointerException.class)
    public void rejectsNullChecksumSupplier() {
        GstConfiguration.builder()
                .initialSearchLength(3)
                .minimumMatchLength(2)
                .checksumSupplier(null)
                .build();
    }
}
