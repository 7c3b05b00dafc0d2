package GSTiling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects optional per-pass statistics for one {@link RkrGst} run without touching the
 * scan loops when instrumentation is disabled.
 */
public final class GstStats {

    private final List<PassStats> passes = new ArrayList<>();
    private final boolean collectStats;
    private long runTimeNanos;

    public GstStats(boolean collectStats) {
        this.collectStats = collectStats;
    }

    public boolean isCollecting() {
        return collectStats;
    }

    void recordPass(PassStats pass) {
        if (collectStats) {
            passes.add(pass);
        }
    }

    void recordRunTime(long nanos) {
        if (collectStats) {
            runTimeNanos = nanos;
        }
    }

    public List<PassStats> passes() {
        return Collections.unmodifiableList(passes);
    }

    public int passCount() {
        return passes.size();
    }

    public int abortedPassCount() {
        int aborted = 0;
        for (PassStats p : passes) {
            if (p.aborted()) {
                aborted++;
            }
        }
        return aborted;
    }

    public long totalCandidates() {
        long total = 0;
        for (PassStats p : passes) {
            total += p.candidates();
        }
        return total;
    }

    public long totalAccepted() {
        long total = 0;
        for (PassStats p : passes) {
            total += p.accepted();
        }
        return total;
    }

    public double runTimeMs() {
        return runTimeNanos / 1_000_000.0;
    }

    @Override
    public String toString() {
        return "GstStats{passes=" + passCount()
                + ", aborted=" + abortedPassCount()
                + ", candidates=" + totalCandidates()
                + ", accepted=" + totalAccepted() + '}';
    }
}
