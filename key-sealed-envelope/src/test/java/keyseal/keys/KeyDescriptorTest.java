package keyseal.keys;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.SoftAssertions.assertSoftly;

import com.grack.nanojson.JsonObject;
import keyseal.crypto.EcCurve;
import keyseal.crypto.Suites;
import org.testng.annotations.Test;

public class KeyDescriptorTest {

    @Test
    public void shouldExportEcKeyPairAsJwk() {
        KeyDescriptor jwk = KeyDescriptor.fromKeyPair("bob-1", EcCurve.P_384.generateKeyPair());

        assertSoftly(softly -> {
            softly.assertThat(jwk.kid()).isEqualTo("bob-1");
            softly.assertThat(jwk.kty()).isEqualTo("EC");
            softly.assertThat(jwk.crv()).isEqualTo("P-384");
            // 48-byte coordinates, unpadded base64url
            softly.assertThat(jwk.x()).hasSize(64).doesNotContain("=");
            softly.assertThat(jwk.y()).hasSize(64);
            softly.assertThat(jwk.d()).hasSize(64);
            softly.assertThat(jwk.n()).isNull();
            softly.assertThat(jwk.isPrivate()).isTrue();
        });
    }

    @Test
    public void shouldExportRsaKeyPairWithCrtMembers() {
        KeyDescriptor jwk = KeyDescriptor.fromKeyPair("alice-1", Suites.RSA.signer().generateKeyPair());

        assertThat(jwk.kty()).isEqualTo("RSA");
        assertThat(jwk.e()).isEqualTo("AQAB");
        assertThat(jwk.n()).hasSize(342);
        assertThat(jwk.p()).isNotNull();
        assertThat(jwk.qi()).isNotNull();
    }

    @Test
    public void shouldStripPrivateMembers() {
        KeyDescriptor jwk = KeyDescriptor.fromKeyPair("alice-1", Suites.RSA.signer().generateKeyPair());

        KeyDescriptor pub = jwk.toPublic();

        assertThat(pub.isPrivate()).isFalse();
        assertThat(pub.d()).isNull();
        assertThat(pub.p()).isNull();
        assertThat(pub.dq()).isNull();
        assertThat(pub.n()).isEqualTo(jwk.n());
        assertThat(pub.toJson()).doesNotContainKeys("d", "p", "q", "dp", "dq", "qi");
    }

    @Test
    public void shouldConvertToAndFromJson() {
        KeyDescriptor jwk = KeyDescriptor.fromKeyPair("bob-1", EcCurve.P_256.generateKeyPair()).withUse("enc");

        JsonObject json = jwk.toJson();

        assertThat(json.getString("crv")).isEqualTo("P-256");
        assertThat(json.getString("use")).isEqualTo("enc");
        assertThat(json).doesNotContainKey("n");
        assertThat(KeyDescriptor.fromJson(json)).isEqualTo(jwk);
    }

    @Test
    public void shouldNotPrintKeyMaterial() {
        KeyDescriptor jwk = KeyDescriptor.fromKeyPair("bob-1", EcCurve.P_256.generateKeyPair());

        assertThat(jwk.toString())
                .isEqualTo("KeyDescriptor[kid=bob-1, kty=EC, crv=P-256, private]")
                .doesNotContain(jwk.d());
    }
}
