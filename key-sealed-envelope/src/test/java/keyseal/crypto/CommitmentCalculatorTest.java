package keyseal.crypto;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import keyseal.model.Util;
import org.testng.annotations.Test;

public class CommitmentCalculatorTest {

    private final CommitmentCalculator calculator = new CommitmentCalculator();

    private static byte[] blob(int length) {
        byte[] blob = new byte[length];
        for (int i = 0; i < length; i++) {
            blob[i] = (byte) i;
        }
        return blob;
    }

    @Test
    public void shouldHashSeparatorThenIvCiphertextAndTag() throws NoSuchAlgorithmException {
        byte[] payload = blob(40);
        MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
        sha256.update("key-sealed-envelope/ctx/v1".getBytes(US_ASCII));
        byte[] expected = sha256.digest(payload);

        assertThat(calculator.commitment(payload)).isEqualTo(expected).hasSize(32);
    }

    @Test
    public void shouldAcceptEmptyCiphertext() {
        assertThat(calculator.commitment(blob(28))).hasSize(32);
    }

    @Test
    public void shouldChangeWithAnyByte() {
        byte[] payload = blob(40);
        byte[] original = calculator.commitment(payload);

        for (int i : new int[] {0, 11, 12, 23, 24, 39}) {
            byte[] changed = payload.clone();
            changed[i] ^= 0x01;
            assertThat(calculator.commitment(changed)).as("byte %d", i).isNotEqualTo(original);
        }
    }

    @Test
    public void shouldVerifyOnlyMatchingCommitments() {
        byte[] payload = blob(40);
        byte[] ctx = calculator.commitment(payload);

        assertThat(calculator.verify(payload, ctx)).isTrue();
        assertThat(calculator.verify(payload, Util.slice(ctx, 0, 31))).isFalse();
        ctx[0] ^= 1;
        assertThat(calculator.verify(payload, ctx)).isFalse();
    }

    @Test
    public void shouldRejectPayloadShorterThanIvAndTag() {
        assertThatIllegalArgumentException().isThrownBy(() -> calculator.commitment(blob(27)));
    }

    @Test
    public void shouldUseInjectedHasher() {
        CommitmentCalculator sha384 = new CommitmentCalculator(new Sha2Hasher("SHA-384"));

        assertThat(sha384.commitment(blob(28))).hasSize(48);
    }
}
