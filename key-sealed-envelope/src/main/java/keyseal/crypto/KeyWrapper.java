package keyseal.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

import javax.crypto.SecretKey;

/**
 * Abstraction for CEK wrapping/unwrapping.
 * The sealer wraps the CEK once per recipient so only that recipient can recover it.
 * Implementations: RSA-OAEP or ephemeral ECDH + AES-GCM.
 */
public interface KeyWrapper {

    String algorithmName();

    /** Generate a key pair for a recipient. */
    KeyPair generateRecipientKeyPair();

    /**
     * Wrap (encrypt) the CEK for a specific recipient.
     * @param cek                the content encryption key to protect
     * @param recipientPublicKey recipient's public key
     * @return opaque wrapped key bytes (format is implementation-specific)
     * @throws GeneralSecurityException if the provider cannot wrap for this key
     */
    byte[] wrap(SecretKey cek, PublicKey recipientPublicKey) throws GeneralSecurityException;

    /**
     * Unwrap (decrypt) the CEK using the recipient's private key.
     * @param wrappedKey          output from {@link #wrap}
     * @param recipientPrivateKey recipient's private key
     * @return the raw CEK bytes
     * @throws GeneralSecurityException if the blob is malformed or fails to decrypt
     */
    byte[] unwrap(byte[] wrappedKey, PrivateKey recipientPrivateKey) throws GeneralSecurityException;
}
