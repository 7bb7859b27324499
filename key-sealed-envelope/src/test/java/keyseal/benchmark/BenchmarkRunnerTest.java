package keyseal.benchmark;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import keyseal.crypto.Suites;
import org.testng.annotations.Test;

public class BenchmarkRunnerTest {

    @Test
    public void shouldRecordEveryMetric() {
        BenchmarkResult result = new BenchmarkRunner(2).run(Suites.EC_P256, new byte[100]);

        assertThat(result.suiteName()).isEqualTo("EC_P256");
        assertThat(result.timings()).containsOnlyKeys(BenchmarkResult.TIME_METRICS);
        assertThat(result.timings().values()).allMatch(nanos -> nanos >= 0);
        assertThat(result.sizes())
                .containsEntry("Signature", 64)
                .containsEntry("Payload", 12 + 100 + 16)
                .containsEntry("WrappedKey", 65 + 12 + 32 + 16);
        assertThat(result.sizes().get("Envelope")).isGreaterThan(result.sizes().get("Payload"));
    }

    @Test
    public void shouldRequirePositiveIterations() {
        assertThatIllegalArgumentException().isThrownBy(() -> new BenchmarkRunner(0));
    }

    @Test
    public void shouldTakeMedian() {
        assertThat(BenchmarkRunner.median(new long[] {1, 5, 9})).isEqualTo(5);
        assertThat(BenchmarkRunner.median(new long[] {1, 3, 5, 100})).isEqualTo(4);
    }

    @Test
    public void shouldPrintTableAndCsv() {
        BenchmarkResult result = new BenchmarkResult("EC_P256");
        result.recordTimeNanos("Seal Total", 12_345_678);
        result.recordSize("Signature", 64);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        ResultPrinter.printTable(List.of(result), 10, new PrintStream(bytes, true, StandardCharsets.UTF_8));

        String output = bytes.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("(10 iterations, median values)").contains("--- CSV");
        assertThat(ResultPrinter.csvHeader()).startsWith("Suite,Seal Encrypt (us)").endsWith("Envelope (B)");
        assertThat(ResultPrinter.csvRow(result)).isEqualTo("EC_P256,-1,-1,-1,-1,12345,-1,-1,-1,-1,-1,64,-1,-1,-1");
    }
}
