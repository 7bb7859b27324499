package keyseal.unsealer;

import keyseal.EnvelopeException;
import keyseal.EnvelopeException.Reason;
import keyseal.canonical.Canonicalizer;
import keyseal.crypto.AesGcmEncryptor;
import keyseal.crypto.AlgorithmSuite;
import keyseal.crypto.CommitmentCalculator;
import keyseal.crypto.Encryptor;
import keyseal.crypto.KeyFamily;
import keyseal.crypto.Suites;
import keyseal.keys.JwkKeyImporter;
import keyseal.keys.KeyDescriptor;
import keyseal.keys.KeyHandle;
import keyseal.keys.KeySet;
import keyseal.keys.KeyUse;
import keyseal.model.Envelope;
import keyseal.model.EnvelopeJson;
import keyseal.model.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static keyseal.EnvelopeException.Reason.ENVELOPE_REJECTED;
import static keyseal.EnvelopeException.Reason.INVALID_COMMITMENT;
import static keyseal.EnvelopeException.Reason.INVALID_SIGNATURE;
import static keyseal.EnvelopeException.Reason.KEY_UNWRAP_FAILURE;
import static keyseal.EnvelopeException.Reason.MIXED_KEY_TYPES;
import static keyseal.EnvelopeException.Reason.NO_CEK_FOR_RECIPIENT;
import static keyseal.EnvelopeException.Reason.UNKNOWN_SENDER;

/**
 * Recipient role.
 *
 * Runs the verification pipeline in a fixed order:
 * 1. Look up the sender's verification key
 * 2. Verify the envelope signature; nothing else is trusted before this passes
 * 3. Find this recipient's wrapped CEK
 * 4. Unwrap the CEK
 * 5. Verify the ciphertext commitment
 * 6. Decrypt and authenticate the payload
 */
public final class Unsealer {

    private static final Logger logger = LoggerFactory.getLogger(Unsealer.class);

    /**
     * Unsealer settings.
     *
     * @param redactFailures report every verification failure as {@code ENVELOPE_REJECTED}, keeping
     *                       the specific reason only as the exception cause
     */
    public record Options(boolean redactFailures) {
        public static final Options DEFAULT = new Options(false);
    }

    private final KeyHandle decryptionKey;
    private final Map<String, KeyHandle> senderKeys;
    private final AlgorithmSuite suite;
    private final Encryptor encryptor;
    private final CommitmentCalculator commitment;
    private final Options options;

    Unsealer(KeyHandle decryptionKey, Map<String, KeyHandle> senderKeys, Encryptor encryptor, Options options) {
        this.decryptionKey = decryptionKey;
        this.senderKeys = Collections.unmodifiableMap(new LinkedHashMap<>(senderKeys));
        this.suite = Suites.forFamily(decryptionKey.family(), decryptionKey.curve());
        this.encryptor = encryptor;
        this.commitment = new CommitmentCalculator();
        this.options = options;
    }

    public static Unsealer create(KeyDescriptor decryptionKey, List<KeyDescriptor> senderPublicKeys) {
        return create(decryptionKey, new KeySet(senderPublicKeys));
    }

    public static Unsealer create(KeyDescriptor decryptionKey, List<KeyDescriptor> senderPublicKeys,
                                  Options options) {
        return create(decryptionKey, new KeySet(senderPublicKeys), options);
    }

    public static Unsealer create(KeyDescriptor decryptionKey, KeySet senderPublicKeys) {
        return create(decryptionKey, senderPublicKeys, Options.DEFAULT);
    }

    /**
     * Imports the decryption key and every sender verification key.
     *
     * @param decryptionKey    this recipient's private RSA-OAEP or ECDH key; its kid addresses the
     *                         recipient in {@link Envelope#cek()}
     * @param senderPublicKeys public RSA-PSS or ECDSA keys of every trusted sender
     * @param options          unsealer settings
     * @throws EnvelopeException with {@code MIXED_KEY_TYPES} if an EC sender key is on a different
     *         curve from an EC decryption key, or an import failure reason
     */
    public static Unsealer create(KeyDescriptor decryptionKey, KeySet senderPublicKeys, Options options) {
        Objects.requireNonNull(options, "options");
        KeyHandle own = JwkKeyImporter.importKey(decryptionKey, KeyUse.UNWRAP);
        Map<String, KeyHandle> senders = new LinkedHashMap<>();
        for (KeyDescriptor descriptor : senderPublicKeys.keys()) {
            KeyHandle sender = JwkKeyImporter.importKey(descriptor.toPublic(), KeyUse.VERIFY);
            if (own.family() == KeyFamily.EC && sender.family() == KeyFamily.EC && own.curve() != sender.curve()) {
                throw new EnvelopeException(MIXED_KEY_TYPES, "All keys must use the same curve");
            }
            senders.put(sender.kid(), sender);
        }
        return new Unsealer(own, senders, new AesGcmEncryptor(), options);
    }

    public String kid() {
        return decryptionKey.kid();
    }

    public Set<String> senderKids() {
        return senderKeys.keySet();
    }

    /** Parses the JSON wire form and unseals it. */
    public byte[] unsealJson(String json) {
        return unseal(EnvelopeJson.fromJson(json));
    }

    /** Unseals and decodes the plaintext as UTF-8. */
    public String unsealString(Envelope envelope) {
        return new String(unseal(envelope), StandardCharsets.UTF_8);
    }

    /**
     * Verifies and decrypts an envelope addressed to this recipient.
     *
     * @return the plaintext bytes
     * @throws EnvelopeException naming the first check that failed
     */
    public byte[] unseal(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        try {
            return doUnseal(envelope);
        } catch (EnvelopeException e) {
            logger.debug("Rejected envelope from {} for {}: {}", envelope.kid(), decryptionKey.kid(), e.reason());
            if (options.redactFailures() && e.reason().isVerificationFailure()) {
                throw new EnvelopeException(ENVELOPE_REJECTED, "Envelope rejected", e);
            }
            throw e;
        }
    }

    private byte[] doUnseal(Envelope envelope) {
        // Step 1: Sender lookup and key-family check
        KeyHandle senderKey = senderKeys.get(envelope.kid());
        if (senderKey == null) {
            throw new EnvelopeException(UNKNOWN_SENDER, "Unknown sender key");
        }
        if (!senderKey.compatibleWith(decryptionKey)) {
            throw new EnvelopeException(MIXED_KEY_TYPES, "Mixed key types not supported");
        }

        // Step 2: Signature over canonical {kid, cek, payload}
        byte[] signedContent = Canonicalizer.canonicalBytes(envelope.signedContent());
        byte[] signature = decode(envelope.signature(), INVALID_SIGNATURE, "Invalid envelope signature");
        if (!suite.verify(signedContent, signature, senderKey.publicKey())) {
            throw new EnvelopeException(INVALID_SIGNATURE, "Invalid envelope signature");
        }

        // Step 3: Our wrapped CEK
        String wrappedCek = envelope.cek().get(decryptionKey.kid());
        if (wrappedCek == null) {
            throw new EnvelopeException(NO_CEK_FOR_RECIPIENT, "No CEK found for recipient");
        }

        // Step 4: Unwrap
        SecretKey cek = unwrap(wrappedCek);

        // Step 5: Commitment over IV, ciphertext and tag
        byte[] encryptedPayload = decode(envelope.payload(), INVALID_COMMITMENT, "Invalid CTX tag");
        byte[] expectedCtx = decode(envelope.ctx(), INVALID_COMMITMENT, "Invalid CTX tag");
        if (encryptedPayload.length < AesGcmEncryptor.IV_BYTES + AesGcmEncryptor.TAG_BYTES
                || !commitment.verify(encryptedPayload, expectedCtx)) {
            throw new EnvelopeException(INVALID_COMMITMENT, "Invalid CTX tag");
        }

        // Step 6: Decrypt; AUTHENTICATION_FAILURE propagates from the encryptor
        byte[] plaintext = encryptor.decrypt(encryptedPayload, cek);
        logger.debug("Unsealed {} byte payload from {} for {}", plaintext.length, envelope.kid(), decryptionKey.kid());
        return plaintext;
    }

    private SecretKey unwrap(String wrappedCek) {
        byte[] wrapped = decode(wrappedCek, KEY_UNWRAP_FAILURE, "Unable to unwrap content key");
        byte[] rawCek = null;
        try {
            rawCek = suite.unwrapKey(wrapped, decryptionKey.privateKey());
            return encryptor.importKey(rawCek);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new EnvelopeException(KEY_UNWRAP_FAILURE, "Unable to unwrap content key", e);
        } finally {
            Util.wipe(rawCek);
        }
    }

    private static byte[] decode(String base64, Reason reason, String message) {
        try {
            return Util.unbase64(base64);
        } catch (IllegalArgumentException e) {
            throw new EnvelopeException(reason, message, e);
        }
    }
}
