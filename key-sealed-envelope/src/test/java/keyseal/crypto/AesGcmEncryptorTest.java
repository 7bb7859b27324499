package keyseal.crypto;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import javax.crypto.SecretKey;

import keyseal.EnvelopeException;
import keyseal.EnvelopeException.Reason;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class AesGcmEncryptorTest {

    private AesGcmEncryptor encryptor;
    private SecretKey key;

    @BeforeMethod
    public void setup() {
        encryptor = new AesGcmEncryptor();
        key = encryptor.generateKey();
    }

    @Test
    public void shouldRoundTrip() {
        byte[] blob = encryptor.encrypt("hello".getBytes(UTF_8), key);

        assertThat(blob).hasSize(AesGcmEncryptor.IV_BYTES + 5 + AesGcmEncryptor.TAG_BYTES);
        assertThat(encryptor.decrypt(blob, key)).asString(UTF_8).isEqualTo("hello");
    }

    @Test
    public void shouldEncryptEmptyPlaintext() {
        byte[] blob = encryptor.encrypt(new byte[0], key);

        assertThat(blob).hasSize(28);
        assertThat(encryptor.decrypt(blob, key)).isEmpty();
    }

    @Test
    public void shouldUseFreshIvPerEncryption() {
        byte[] first = encryptor.encrypt("same".getBytes(UTF_8), key);
        byte[] second = encryptor.encrypt("same".getBytes(UTF_8), key);

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    public void shouldGenerate256BitKeys() {
        assertThat(key.getEncoded()).hasSize(32);
        assertThat(encryptor.generateKey().getEncoded()).isNotEqualTo(key.getEncoded());
    }

    @Test
    public void shouldRejectTamperedCiphertext() {
        byte[] blob = encryptor.encrypt("hello".getBytes(UTF_8), key);
        blob[AesGcmEncryptor.IV_BYTES] ^= 1;

        assertAuthenticationFailure(() -> encryptor.decrypt(blob, key));
    }

    @Test
    public void shouldRejectWrongKey() {
        byte[] blob = encryptor.encrypt("hello".getBytes(UTF_8), key);

        assertAuthenticationFailure(() -> encryptor.decrypt(blob, encryptor.generateKey()));
    }

    @Test
    public void shouldRejectTruncatedBlob() {
        assertAuthenticationFailure(() -> encryptor.decrypt(new byte[27], key));
    }

    @Test
    public void shouldOnlyImport256BitKeys() {
        assertThat(encryptor.importKey(key.getEncoded()).getEncoded()).isEqualTo(key.getEncoded());
        assertThatIllegalArgumentException().isThrownBy(() -> encryptor.importKey(new byte[16]));
    }

    private static void assertAuthenticationFailure(Runnable call) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(EnvelopeException.class,
                        e -> assertThat(e.reason()).isEqualTo(Reason.AUTHENTICATION_FAILURE));
    }
}
