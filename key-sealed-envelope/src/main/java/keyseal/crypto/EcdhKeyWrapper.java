package keyseal.crypto;

import keyseal.model.Util;

import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.ECPublicKey;

/**
 * ECDH key wrapping with a fresh ephemeral key pair per recipient per seal.
 * The AES-256 wrapping key is the leading 32 bytes of the raw ECDH shared secret, which is what
 * WebCrypto's {@code deriveKey(ECDH -> AES-GCM 256)} produces.
 *
 * Wrapped output format: [ephemeral public key, uncompressed][12-byte IV][encrypted CEK + 16-byte tag].
 * The ephemeral key is 65 bytes on P-256 and 97 bytes on P-384.
 */
public class EcdhKeyWrapper implements KeyWrapper {

    private static final int WRAPPING_KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final EcCurve curve;
    private final SecureRandom random;

    public EcdhKeyWrapper(EcCurve curve) {
        this(curve, new SecureRandom());
    }

    public EcdhKeyWrapper(EcCurve curve, SecureRandom random) {
        this.curve = curve;
        this.random = random;
    }

    public EcCurve curve() {
        return curve;
    }

    @Override
    public String algorithmName() {
        return "ECDH-" + curve.jwkName() + "+A256GCM";
    }

    @Override
    public KeyPair generateRecipientKeyPair() {
        return curve.generateKeyPair();
    }

    @Override
    public byte[] wrap(SecretKey cek, PublicKey recipientPublicKey) throws GeneralSecurityException {
        // Ephemeral key pair lives only for this wrap operation
        KeyPair ephemeral = curve.generateKeyPair();
        byte[] wrappingKey = agree(ephemeral.getPrivate(), recipientPublicKey);
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE,
                    new SecretKeySpec(wrappingKey, "AES"),
                    new GCMParameterSpec(TAG_BITS, iv));
            byte[] wrapped = cipher.doFinal(cek.getEncoded());

            byte[] ephPub = curve.encodeUncompressed((ECPublicKey) ephemeral.getPublic());
            return Util.concat(ephPub, iv, wrapped);
        } finally {
            Util.wipe(wrappingKey);
        }
    }

    @Override
    public byte[] unwrap(byte[] wrappedKey, PrivateKey recipientPrivateKey) throws GeneralSecurityException {
        int pointLen = curve.uncompressedPointLength();
        if (wrappedKey.length < pointLen + IV_BYTES + TAG_BITS / 8) {
            throw new GeneralSecurityException("Wrapped key is too short for " + curve.jwkName());
        }
        PublicKey ephPub = curve.decodeUncompressed(Util.slice(wrappedKey, 0, pointLen));

        byte[] wrappingKey = agree(recipientPrivateKey, ephPub);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE,
                    new SecretKeySpec(wrappingKey, "AES"),
                    new GCMParameterSpec(TAG_BITS, wrappedKey, pointLen, IV_BYTES));
            int offset = pointLen + IV_BYTES;
            return cipher.doFinal(wrappedKey, offset, wrappedKey.length - offset);
        } finally {
            Util.wipe(wrappingKey);
        }
    }

    private static byte[] agree(PrivateKey privateKey, PublicKey publicKey) throws GeneralSecurityException {
        KeyAgreement ka = KeyAgreement.getInstance("ECDH");
        ka.init(privateKey);
        ka.doPhase(publicKey, true);
        byte[] sharedSecret = ka.generateSecret();
        try {
            return Util.slice(sharedSecret, 0, WRAPPING_KEY_BYTES);
        } finally {
            Util.wipe(sharedSecret);
        }
    }
}
