package keyseal.crypto;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Optional;

import javax.crypto.SecretKey;

/**
 * Bundles the signature and key-wrapping primitives of one key family.
 * There are exactly two variants, {@link RsaSuite} and {@link EcSuite}; a sealer or unsealer picks
 * one when it is created and uses it for every call.
 */
public interface AlgorithmSuite {

    String name();

    KeyFamily family();

    /** The curve for EC suites, empty for RSA. */
    Optional<EcCurve> curve();

    Signer signer();

    KeyWrapper keyWrapper();

    default byte[] sign(byte[] data, PrivateKey signingKey) {
        return signer().sign(data, signingKey);
    }

    default boolean verify(byte[] data, byte[] signature, PublicKey verificationKey) {
        return signer().verify(data, signature, verificationKey);
    }

    default byte[] wrapKey(SecretKey cek, PublicKey recipientKey) throws GeneralSecurityException {
        return keyWrapper().wrap(cek, recipientKey);
    }

    default byte[] unwrapKey(byte[] wrappedKey, PrivateKey recipientKey) throws GeneralSecurityException {
        return keyWrapper().unwrap(wrappedKey, recipientKey);
    }
}
