package keyseal.crypto;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Abstraction for the envelope signature.
 * One implementation per key family: RSA-PSS and ECDSA.
 */
public interface Signer {

    /** Human-readable algorithm name for logs and benchmark output. */
    String algorithmName();

    /** Generate a fresh key pair suitable for this signing scheme. */
    KeyPair generateKeyPair();

    /** Sign the given data using the private key. */
    byte[] sign(byte[] data, PrivateKey privateKey);

    /**
     * Verify a signature against the given data and public key.
     * Malformed signatures verify as {@code false} rather than throwing.
     */
    boolean verify(byte[] data, byte[] signature, PublicKey publicKey);
}
