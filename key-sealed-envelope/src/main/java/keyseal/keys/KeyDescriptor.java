package keyseal.keys;

import com.grack.nanojson.JsonBuilder;
import com.grack.nanojson.JsonObject;
import keyseal.crypto.EcCurve;
import keyseal.model.Util;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Objects;

/**
 * A named JSON Web Key: the key descriptor sealers and unsealers are built from.
 * Binary members hold the unpadded base64url strings of the JWK; members that do not apply to the
 * key type (or to a public key) are {@code null}.
 */
public record KeyDescriptor(
        String kid,
        String kty,
        String crv,
        String use,
        String alg,
        String n,
        String e,
        String x,
        String y,
        String d,
        String p,
        String q,
        String dp,
        String dq,
        String qi
) {
    public KeyDescriptor {
        Objects.requireNonNull(kid, "kid");
        Objects.requireNonNull(kty, "kty");
    }

    public static KeyDescriptor rsaPublic(String kid, String n, String e) {
        return new KeyDescriptor(kid, "RSA", null, null, null, n, e, null, null, null, null, null, null, null, null);
    }

    public static KeyDescriptor ecPublic(String kid, String crv, String x, String y) {
        return new KeyDescriptor(kid, "EC", crv, null, null, null, null, x, y, null, null, null, null, null, null);
    }

    /**
     * Exports a JCA key pair, as WebCrypto's {@code exportKey("jwk")} would, under the given kid.
     */
    public static KeyDescriptor fromKeyPair(String kid, KeyPair keyPair) {
        if (keyPair.getPublic() instanceof RSAPublicKey) {
            RSAPublicKey pub = (RSAPublicKey) keyPair.getPublic();
            KeyDescriptor descriptor = rsaPublic(kid, b64(pub.getModulus()), b64(pub.getPublicExponent()));
            if (keyPair.getPrivate() instanceof RSAPrivateCrtKey) {
                RSAPrivateCrtKey priv = (RSAPrivateCrtKey) keyPair.getPrivate();
                return new KeyDescriptor(kid, "RSA", null, null, null, descriptor.n, descriptor.e, null, null,
                        b64(priv.getPrivateExponent()), b64(priv.getPrimeP()), b64(priv.getPrimeQ()),
                        b64(priv.getPrimeExponentP()), b64(priv.getPrimeExponentQ()), b64(priv.getCrtCoefficient()));
            }
            if (keyPair.getPrivate() instanceof RSAPrivateKey) {
                RSAPrivateKey priv = (RSAPrivateKey) keyPair.getPrivate();
                return descriptor.withPrivateExponent(b64(priv.getPrivateExponent()));
            }
            return descriptor;
        }
        if (keyPair.getPublic() instanceof ECPublicKey) {
            ECPublicKey pub = (ECPublicKey) keyPair.getPublic();
            EcCurve curve = EcCurve.of(pub.getParams())
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported EC curve"));
            int len = curve.fieldBytes();
            KeyDescriptor descriptor = ecPublic(kid, curve.jwkName(),
                    b64(pub.getW().getAffineX(), len), b64(pub.getW().getAffineY(), len));
            if (keyPair.getPrivate() instanceof ECPrivateKey) {
                ECPrivateKey priv = (ECPrivateKey) keyPair.getPrivate();
                return descriptor.withPrivateExponent(b64(priv.getS(), len));
            }
            return descriptor;
        }
        throw new IllegalArgumentException("Unsupported key type: " + keyPair.getPublic().getAlgorithm());
    }

    public boolean isPrivate() {
        return d != null;
    }

    /** Strips every private member. */
    public KeyDescriptor toPublic() {
        return new KeyDescriptor(kid, kty, crv, use, alg, n, e, x, y, null, null, null, null, null, null);
    }

    public KeyDescriptor withKid(String newKid) {
        return new KeyDescriptor(newKid, kty, crv, use, alg, n, e, x, y, d, p, q, dp, dq, qi);
    }

    public KeyDescriptor withUse(String newUse) {
        return new KeyDescriptor(kid, kty, crv, newUse, alg, n, e, x, y, d, p, q, dp, dq, qi);
    }

    private KeyDescriptor withPrivateExponent(String newD) {
        return new KeyDescriptor(kid, kty, crv, use, alg, n, e, x, y, newD, p, q, dp, dq, qi);
    }

    public static KeyDescriptor fromJson(JsonObject json) {
        return new KeyDescriptor(
                json.getString("kid"),
                json.getString("kty"),
                json.getString("crv"),
                json.getString("use"),
                json.getString("alg"),
                json.getString("n"),
                json.getString("e"),
                json.getString("x"),
                json.getString("y"),
                json.getString("d"),
                json.getString("p"),
                json.getString("q"),
                json.getString("dp"),
                json.getString("dq"),
                json.getString("qi"));
    }

    public JsonObject toJson() {
        JsonBuilder<JsonObject> builder = JsonObject.builder()
                .value("kid", kid)
                .value("kty", kty);
        member(builder, "crv", crv);
        member(builder, "use", use);
        member(builder, "alg", alg);
        member(builder, "n", n);
        member(builder, "e", e);
        member(builder, "x", x);
        member(builder, "y", y);
        member(builder, "d", d);
        member(builder, "p", p);
        member(builder, "q", q);
        member(builder, "dp", dp);
        member(builder, "dq", dq);
        member(builder, "qi", qi);
        return builder.done();
    }

    /** Omits the private members so descriptors can be logged. */
    @Override
    public String toString() {
        return "KeyDescriptor[kid=" + kid + ", kty=" + kty + (crv != null ? ", crv=" + crv : "")
                + (isPrivate() ? ", private" : ", public") + "]";
    }

    private static void member(JsonBuilder<JsonObject> builder, String name, String value) {
        if (value != null) {
            builder.value(name, value);
        }
    }

    private static String b64(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Util.slice(bytes, 1, bytes.length);
        }
        return Util.base64url(bytes);
    }

    private static String b64(BigInteger value, int length) {
        byte[] bytes = value.toByteArray();
        byte[] fixed = new byte[length];
        if (bytes.length >= length) {
            System.arraycopy(bytes, bytes.length - length, fixed, 0, length);
        } else {
            System.arraycopy(bytes, 0, fixed, length - bytes.length, bytes.length);
        }
        return Util.base64url(fixed);
    }
}
