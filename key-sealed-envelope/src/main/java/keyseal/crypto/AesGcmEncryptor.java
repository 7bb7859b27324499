package keyseal.crypto;

import keyseal.EnvelopeException;
import keyseal.model.Util;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM content cipher with a 96-bit random IV and a 128-bit tag.
 * Blob layout: [12-byte IV][ciphertext][16-byte tag].
 */
public class AesGcmEncryptor implements Encryptor {

    public static final int KEY_BYTES = 32;
    public static final int IV_BYTES = 12;
    public static final int TAG_BYTES = 16;

    private static final int GCM_TAG_BITS = TAG_BYTES * 8;

    private final SecureRandom random;

    public AesGcmEncryptor() {
        this(new SecureRandom());
    }

    public AesGcmEncryptor(SecureRandom random) {
        this.random = random;
    }

    @Override
    public String algorithmName() {
        return "AES-256-GCM";
    }

    @Override
    public SecretKey generateKey() {
        try {
            KeyGenerator kg = KeyGenerator.getInstance("AES");
            kg.init(KEY_BYTES * 8, random);
            return kg.generateKey();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public SecretKey importKey(byte[] rawKey) {
        if (rawKey.length != KEY_BYTES) {
            throw new IllegalArgumentException("CEK must be " + KEY_BYTES + " bytes, got " + rawKey.length);
        }
        return new SecretKeySpec(rawKey, "AES");
    }

    @Override
    public byte[] encrypt(byte[] plaintext, SecretKey key) {
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            return Util.concat(iv, cipher.doFinal(plaintext)); // ciphertext + tag appended
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] blob, SecretKey key) {
        if (blob.length < IV_BYTES + TAG_BYTES) {
            throw new EnvelopeException(EnvelopeException.Reason.AUTHENTICATION_FAILURE,
                    "Encrypted payload is too short");
        }
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, blob, 0, IV_BYTES));
            return cipher.doFinal(blob, IV_BYTES, blob.length - IV_BYTES);
        } catch (AEADBadTagException e) {
            throw new EnvelopeException(EnvelopeException.Reason.AUTHENTICATION_FAILURE,
                    "Payload authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        }
    }
}
