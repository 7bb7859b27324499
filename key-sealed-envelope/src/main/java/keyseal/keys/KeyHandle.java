package keyseal.keys;

import keyseal.crypto.EcCurve;
import keyseal.crypto.KeyFamily;

import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;
import java.util.Optional;

/**
 * An imported JCA key together with its id, family, curve and intended use.
 *
 * @param curve the named curve for EC keys, {@code null} for RSA
 */
public record KeyHandle(String kid, KeyFamily family, EcCurve curve, KeyUse use, Key key) {

    public KeyHandle {
        Objects.requireNonNull(kid, "kid");
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(use, "use");
        Objects.requireNonNull(key, "key");
    }

    public Optional<EcCurve> ecCurve() {
        return Optional.ofNullable(curve);
    }

    /** True when both keys belong to the same family and, for EC, the same curve. */
    public boolean compatibleWith(KeyHandle other) {
        return family == other.family && curve == other.curve;
    }

    public PrivateKey privateKey() {
        if (!(key instanceof PrivateKey)) {
            throw new IllegalStateException("Key " + kid + " is not a private key");
        }
        return (PrivateKey) key;
    }

    public PublicKey publicKey() {
        if (!(key instanceof PublicKey)) {
            throw new IllegalStateException("Key " + kid + " is not a public key");
        }
        return (PublicKey) key;
    }

    @Override
    public String toString() {
        return "KeyHandle[kid=" + kid + ", family=" + family
                + (curve != null ? ", curve=" + curve.jwkName() : "") + ", use=" + use + "]";
    }
}
