package keyseal.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;

import org.testng.annotations.Test;

public class EcCurveTest {

    @Test
    public void shouldKnowPointLengths() {
        assertThat(EcCurve.P_256.uncompressedPointLength()).isEqualTo(65);
        assertThat(EcCurve.P_384.uncompressedPointLength()).isEqualTo(97);
    }

    @Test
    public void shouldLookUpJwkNames() {
        assertThat(EcCurve.fromJwkName("P-384")).contains(EcCurve.P_384);
        assertThat(EcCurve.fromJwkName("P-521")).isEmpty();
        assertThat(EcCurve.fromJwkName(null)).isEmpty();
    }

    @Test
    public void shouldIdentifyGeneratedKeys() {
        ECPublicKey key = (ECPublicKey) EcCurve.P_384.generateKeyPair().getPublic();

        assertThat(EcCurve.of(key.getParams())).contains(EcCurve.P_384);
    }

    @Test
    public void shouldDecodeWhatItEncodes() throws GeneralSecurityException {
        ECPublicKey key = (ECPublicKey) EcCurve.P_256.generateKeyPair().getPublic();

        byte[] encoded = EcCurve.P_256.encodeUncompressed(key);
        PublicKey decoded = EcCurve.P_256.decodeUncompressed(encoded);

        assertThat(((ECPublicKey) decoded).getW()).isEqualTo(key.getW());
    }

    @Test
    public void shouldRejectForeignEncodings() throws GeneralSecurityException {
        byte[] encoded = EcCurve.P_256.encodeUncompressed((ECPublicKey) EcCurve.P_256.generateKeyPair().getPublic());
        byte[] compressed = encoded.clone();
        compressed[0] = 0x02;

        assertThatThrownBy(() -> EcCurve.P_384.decodeUncompressed(encoded)).isInstanceOf(GeneralSecurityException.class);
        assertThatThrownBy(() -> EcCurve.P_256.decodeUncompressed(compressed)).isInstanceOf(GeneralSecurityException.class);
    }

    @Test
    public void shouldPickSuiteForFamily() {
        assertThat(Suites.forFamily(KeyFamily.RSA, null)).isSameAs(Suites.RSA);
        assertThat(Suites.forFamily(KeyFamily.EC, EcCurve.P_256)).isSameAs(Suites.EC_P256);
        assertThat(Suites.forFamily(KeyFamily.EC, EcCurve.P_384).name()).isEqualTo("EC_P384");
        assertThatIllegalArgumentException().isThrownBy(() -> Suites.forFamily(KeyFamily.EC, null));
    }
}
