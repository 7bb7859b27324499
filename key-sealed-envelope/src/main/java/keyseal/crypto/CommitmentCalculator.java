package keyseal.crypto;

import keyseal.model.Util;

import java.nio.charset.StandardCharsets;

/**
 * Computes the ciphertext commitment tag {@code ctx} of an envelope:
 * {@code SHA-256(DOMAIN_SEPARATOR || IV || ciphertext || tag)}.
 *
 * The commitment does not depend on the CEK, so every recipient can check that it received the
 * payload ciphertext the sender committed to before trusting decrypted output.
 */
public final class CommitmentCalculator {

    /** Shared by every sealing and unsealing implementation; changing it breaks interop. */
    public static final String DOMAIN_SEPARATOR = "key-sealed-envelope/ctx/v1";

    private static final byte[] SEPARATOR_BYTES = DOMAIN_SEPARATOR.getBytes(StandardCharsets.US_ASCII);

    private final Hasher hasher;

    public CommitmentCalculator() {
        this(new Sha2Hasher("SHA-256"));
    }

    CommitmentCalculator(Hasher hasher) {
        this.hasher = hasher;
    }

    /**
     * @param encryptedPayload {@code IV || ciphertext || tag} as produced by {@link AesGcmEncryptor}
     * @throws IllegalArgumentException if the payload is shorter than IV plus tag
     */
    public byte[] commitment(byte[] encryptedPayload) {
        int ivLen = AesGcmEncryptor.IV_BYTES;
        int tagLen = AesGcmEncryptor.TAG_BYTES;
        if (encryptedPayload.length < ivLen + tagLen) {
            throw new IllegalArgumentException("Encrypted payload must be at least "
                    + (ivLen + tagLen) + " bytes");
        }
        int tagStart = encryptedPayload.length - tagLen;
        return hasher.hash(
                SEPARATOR_BYTES,
                Util.slice(encryptedPayload, 0, ivLen),
                Util.slice(encryptedPayload, ivLen, tagStart),
                Util.slice(encryptedPayload, tagStart, encryptedPayload.length));
    }

    /** Recomputes the commitment and compares it in constant time. */
    public boolean verify(byte[] encryptedPayload, byte[] expected) {
        return Util.constantTimeEquals(commitment(encryptedPayload), expected);
    }
}
