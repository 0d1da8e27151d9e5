package hle.closerpool;

import java.util.Arrays;

/**
 * Latency and throughput figures of a {@link RequestRunner} run.
 */
public final class Stats {
    private final int queries;
    private final int failures;
    private final long totalTimeNanos;
    private final double throughputPerSec;
    private final double avgMillis;
    private final double p50Millis;
    private final double p95Millis;
    private final double maxMillis;

    private Stats(int queries,
                  int failures,
                  long totalTimeNanos,
                  double throughputPerSec,
                  double avgMillis,
                  double p50Millis,
                  double p95Millis,
                  double maxMillis) {
        this.queries = queries;
        this.failures = failures;
        this.totalTimeNanos = totalTimeNanos;
        this.throughputPerSec = throughputPerSec;
        this.avgMillis = avgMillis;
        this.p50Millis = p50Millis;
        this.p95Millis = p95Millis;
        this.maxMillis = maxMillis;
    }

    public static Stats from(long[] durationsNanos, int failures, long totalTimeNanos) {
        int queries = durationsNanos.length;
        double totalSeconds = totalTimeNanos / 1_000_000_000.0;
        double throughputPerSec = totalSeconds > 0 ? queries / totalSeconds : 0.0;

        long[] sorted = Arrays.copyOf(durationsNanos, durationsNanos.length);
        Arrays.sort(sorted);

        double avgMillis = queries > 0 ? nanosToMillis(Arrays.stream(sorted).sum() / (double) queries) : 0.0;
        double maxMillis = queries > 0 ? nanosToMillis(sorted[queries - 1]) : 0.0;

        return new Stats(queries, failures, totalTimeNanos, throughputPerSec, avgMillis,
                percentileMillis(sorted, 0.50), percentileMillis(sorted, 0.95), maxMillis);
    }

    // nearest-rank percentile over an ascending array
    private static double percentileMillis(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int index = (int) Math.ceil(percentile * sorted.length) - 1;
        index = Math.max(0, Math.min(index, sorted.length - 1));
        return nanosToMillis(sorted[index]);
    }

    private static double nanosToMillis(double nanos) {
        return nanos / 1_000_000.0;
    }

    public int getQueries() {
        return queries;
    }

    public int getFailures() {
        return failures;
    }

    public long getTotalTimeNanos() {
        return totalTimeNanos;
    }

    public double getThroughputPerSec() {
        return throughputPerSec;
    }

    public double getAvgMillis() {
        return avgMillis;
    }

    public double getP50Millis() {
        return p50Millis;
    }

    public double getP95Millis() {
        return p95Millis;
    }

    public double getMaxMillis() {
        return maxMillis;
    }
}
