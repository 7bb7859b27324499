package keyseal.benchmark;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints benchmark results as a formatted comparison table followed by a CSV block.
 */
public final class ResultPrinter {

    private static final int NAME_WIDTH = 10;
    private static final int COLUMN_WIDTH = 16;

    private ResultPrinter() {}

    public static void printTable(List<BenchmarkResult> results, int iterations) {
        printTable(results, iterations, System.out);
    }

    public static void printTable(List<BenchmarkResult> results, int iterations, PrintStream out) {
        List<String> timeMetrics = BenchmarkResult.TIME_METRICS;
        List<String> sizeMetrics = BenchmarkResult.SIZE_METRICS;

        out.println();
        out.println("=".repeat(120));
        out.println("  KEY-SEALED ENVELOPE SUITE COMPARISON");
        out.println("  (" + iterations + " iterations, median values)");
        out.println("=".repeat(120));
        out.println();

        header(out, timeMetrics, " (us)");
        for (BenchmarkResult r : results) {
            out.printf("%-" + NAME_WIDTH + "s", r.suiteName());
            for (String m : timeMetrics) {
                out.printf(" | %" + COLUMN_WIDTH + "d", micros(r, m));
            }
            out.println();
        }
        out.println();

        header(out, sizeMetrics, " (B)");
        for (BenchmarkResult r : results) {
            out.printf("%-" + NAME_WIDTH + "s", r.suiteName());
            for (String m : sizeMetrics) {
                out.printf(" | %" + COLUMN_WIDTH + "d", bytes(r, m));
            }
            out.println();
        }
        out.println();

        out.println("--- CSV (for spreadsheet import) ---");
        out.println(csvHeader());
        for (BenchmarkResult r : results) {
            out.println(csvRow(r));
        }
    }

    static String csvHeader() {
        StringBuilder sb = new StringBuilder("Suite");
        for (String m : BenchmarkResult.TIME_METRICS) sb.append(',').append(m).append(" (us)");
        for (String m : BenchmarkResult.SIZE_METRICS) sb.append(',').append(m).append(" (B)");
        return sb.toString();
    }

    static String csvRow(BenchmarkResult r) {
        StringBuilder sb = new StringBuilder(r.suiteName());
        for (String m : BenchmarkResult.TIME_METRICS) sb.append(',').append(micros(r, m));
        for (String m : BenchmarkResult.SIZE_METRICS) sb.append(',').append(bytes(r, m));
        return sb.toString();
    }

    private static void header(PrintStream out, List<String> metrics, String unit) {
        out.printf("%-" + NAME_WIDTH + "s", "Suite");
        for (String m : metrics) {
            out.printf(" | %" + COLUMN_WIDTH + "s", m + unit);
        }
        out.println();
        out.println("-".repeat(NAME_WIDTH) + ("-+-" + "-".repeat(COLUMN_WIDTH)).repeat(metrics.size()));
    }

    private static long micros(BenchmarkResult r, String metric) {
        Long nanos = r.timings().get(metric);
        return nanos != null ? BenchmarkResult.toMicros(nanos) : -1;
    }

    private static int bytes(BenchmarkResult r, String metric) {
        Integer bytes = r.sizes().get(metric);
        return bytes != null ? bytes : -1;
    }
}
