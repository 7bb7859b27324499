package keyseal;

import static org.assertj.core.api.Assertions.assertThat;

import keyseal.crypto.AlgorithmSuite;
import keyseal.crypto.Suites;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class MainTest {

    @DataProvider
    public Object[][] suites() {
        return Suites.all().stream().map(suite -> new Object[] {suite}).toArray(Object[][]::new);
    }

    @Test(dataProvider = "suites")
    public void shouldPassSmokeTest(AlgorithmSuite suite) {
        assertThat(Main.smokeTest(suite)).isTrue();
    }

    @Test
    public void shouldBuildDeterministicSamplePayload() {
        assertThat(Main.samplePayload(4)).containsExactly(7, 38, 69, 100);
        assertThat(Main.samplePayload(1024)).isEqualTo(Main.samplePayload(1024));
    }

    @Test
    public void shouldFallBackToDefaultIterationsForInvalidArguments() {
        assertThat(Main.parseIterations(new String[0])).isEqualTo(100);
        assertThat(Main.parseIterations(new String[] {"25"})).isEqualTo(25);
        assertThat(Main.parseIterations(new String[] {"0"})).isEqualTo(100);
        assertThat(Main.parseIterations(new String[] {"-3"})).isEqualTo(100);
        assertThat(Main.parseIterations(new String[] {"many"})).isEqualTo(100);
    }
}
