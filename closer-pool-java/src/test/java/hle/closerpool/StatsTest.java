package hle.closerpool;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatsTest {

    @Test
    void shouldComputeLatencyPercentiles() {
        long[] durations = new long[20];
        for (int i = 0; i < durations.length; i++) {
            durations[i] = (20 - i) * 1_000_000L;
        }

        Stats stats = Stats.from(durations, 2, 2_000_000_000L);

        assertEquals(20, stats.getQueries());
        assertEquals(2, stats.getFailures());
        assertEquals(10.0, stats.getThroughputPerSec(), 1e-9);
        assertEquals(10.5, stats.getAvgMillis(), 1e-9);
        assertEquals(10.0, stats.getP50Millis(), 1e-9);
        assertEquals(19.0, stats.getP95Millis(), 1e-9);
        assertEquals(20.0, stats.getMaxMillis(), 1e-9);
    }

    @Test
    void shouldHandleEmptyRun() {
        Stats stats = Stats.from(new long[0], 0, 0L);

        assertEquals(0, stats.getQueries());
        assertEquals(0.0, stats.getThroughputPerSec());
        assertEquals(0.0, stats.getAvgMillis());
        assertEquals(0.0, stats.getP95Millis());
        assertEquals(0.0, stats.getMaxMillis());
    }
}
