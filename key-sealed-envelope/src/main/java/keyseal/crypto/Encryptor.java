package keyseal.crypto;

import javax.crypto.SecretKey;

/**
 * Abstraction for the content cipher (AEAD) that encrypts the envelope payload under a CEK.
 */
public interface Encryptor {

    String algorithmName();

    /** Generate a fresh, never reused content encryption key. */
    SecretKey generateKey();

    /** Import raw key bytes recovered by a {@link KeyWrapper}. */
    SecretKey importKey(byte[] rawKey);

    /**
     * Encrypt under a fresh random IV.
     * @return {@code IV || ciphertext || tag}
     */
    byte[] encrypt(byte[] plaintext, SecretKey key);

    /**
     * Split the IV from a blob produced by {@link #encrypt} and decrypt the remainder.
     * @throws keyseal.EnvelopeException with {@code AUTHENTICATION_FAILURE} when the tag does not verify
     */
    byte[] decrypt(byte[] blob, SecretKey key);
}
