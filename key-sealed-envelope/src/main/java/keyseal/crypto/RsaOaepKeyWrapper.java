package keyseal.crypto;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.RSAKeyGenParameterSpec;

/**
 * RSA-OAEP key wrapping (SHA-256, MGF1-SHA-256, empty label).
 * The raw CEK bytes are directly encrypted with the recipient's RSA public key, so the
 * wrapped output is as long as the recipient's modulus.
 */
public class RsaOaepKeyWrapper implements KeyWrapper {

    private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    private final int keySize;

    public RsaOaepKeyWrapper() {
        this(2048);
    }

    public RsaOaepKeyWrapper(int keySize) {
        this.keySize = keySize;
    }

    @Override
    public String algorithmName() {
        return "RSA-" + keySize + "-OAEP";
    }

    @Override
    public KeyPair generateRecipientKeyPair() {
        try {
            KeyPairGenerator kpg = KeyPairGenerator.getInstance("RSA");
            kpg.initialize(new RSAKeyGenParameterSpec(keySize, RSAKeyGenParameterSpec.F4));
            return kpg.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public byte[] wrap(SecretKey cek, PublicKey recipientPublicKey) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance("RSA/ECB/OAEPPadding");
        cipher.init(Cipher.ENCRYPT_MODE, recipientPublicKey, OAEP_SHA256);
        return cipher.doFinal(cek.getEncoded());
    }

    @Override
    public byte[] unwrap(byte[] wrappedKey, PrivateKey recipientPrivateKey) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance("RSA/ECB/OAEPPadding");
        cipher.init(Cipher.DECRYPT_MODE, recipientPrivateKey, OAEP_SHA256);
        return cipher.doFinal(wrappedKey);
    }
}
