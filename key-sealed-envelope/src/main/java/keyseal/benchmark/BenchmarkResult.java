package keyseal.benchmark;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collected timing and size measurements for a single algorithm suite.
 * All times are in nanoseconds; use {@link #toMicros} for display.
 */
public class BenchmarkResult {

    public static final List<String> TIME_METRICS = List.of(
            "Seal Encrypt", "Seal Wrap", "Seal Sign", "Seal Commit", "Seal Total",
            "Open Verify", "Open Unwrap", "Open Commit", "Open Decrypt", "Open Total");

    public static final List<String> SIZE_METRICS = List.of(
            "Signature", "Payload", "WrappedKey", "Envelope");

    private final String suiteName;
    private final Map<String, Long> timings = new LinkedHashMap<>();
    private final Map<String, Integer> sizes = new LinkedHashMap<>();

    public BenchmarkResult(String suiteName) {
        this.suiteName = suiteName;
    }

    public String suiteName() { return suiteName; }
    public Map<String, Long> timings() { return timings; }
    public Map<String, Integer> sizes() { return sizes; }

    public void recordTimeNanos(String metric, long nanos) {
        timings.put(metric, nanos);
    }

    public void recordSize(String metric, int bytes) {
        sizes.put(metric, bytes);
    }

    public static long toMicros(long nanos) {
        return nanos / 1_000;
    }
}
