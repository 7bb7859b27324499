package keyseal.crypto;

/**
 * Abstraction for cryptographic hashing.
 * Used to compute the envelope's ciphertext commitment.
 */
public interface Hasher {

    String algorithmName();

    /** Compute the hash of the concatenation of the given parts. */
    byte[] hash(byte[]... parts);
}
