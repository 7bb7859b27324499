package keyseal.sealer;

import keyseal.EnvelopeException;
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
import keyseal.model.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static keyseal.EnvelopeException.Reason.KEY_WRAP_FAILURE;
import static keyseal.EnvelopeException.Reason.MIXED_KEY_TYPES;
import static keyseal.EnvelopeException.Reason.NO_RECIPIENTS;
import static keyseal.EnvelopeException.Reason.UNKNOWN_RECIPIENT;

/**
 * Sender role.
 *
 * Responsible for:
 * 1. Generating a fresh content encryption key (CEK)
 * 2. Encrypting the payload once (AES-256-GCM)
 * 3. Wrapping the CEK for each recipient
 * 4. Signing the canonical {@code {kid, cek, payload}} with the sender's key
 * 5. Computing the ciphertext commitment
 *
 * Instances are immutable and may be shared between threads; each call generates its own CEK, IVs
 * and ephemeral keys.
 */
public final class Sealer {

    private static final Logger logger = LoggerFactory.getLogger(Sealer.class);

    private final KeyHandle signingKey;
    private final Map<String, KeyHandle> recipientKeys;
    private final AlgorithmSuite suite;
    private final Encryptor encryptor;
    private final CommitmentCalculator commitment;

    Sealer(KeyHandle signingKey, Map<String, KeyHandle> recipientKeys, Encryptor encryptor) {
        this.signingKey = signingKey;
        this.recipientKeys = Collections.unmodifiableMap(new LinkedHashMap<>(recipientKeys));
        this.suite = Suites.forFamily(signingKey.family(), signingKey.curve());
        this.encryptor = encryptor;
        this.commitment = new CommitmentCalculator();
    }

    public static Sealer create(KeyDescriptor signingKey, List<KeyDescriptor> recipientPublicKeys) {
        return create(signingKey, new KeySet(recipientPublicKeys));
    }

    public static Sealer create(KeyDescriptor signingKey, KeySet recipientPublicKeys) {
        return create(signingKey, recipientPublicKeys, new AesGcmEncryptor());
    }

    /**
     * Imports the signing key and every recipient key.
     *
     * @param signingKey          private RSA-PSS or ECDSA key of the sender
     * @param recipientPublicKeys public RSA-OAEP or ECDH keys of every possible recipient
     * @param encryptor           content cipher for the payload
     * @throws EnvelopeException with {@code MIXED_KEY_TYPES} if an EC recipient key is on a different
     *         curve from an EC signing key, or an import failure reason
     */
    public static Sealer create(KeyDescriptor signingKey, KeySet recipientPublicKeys, Encryptor encryptor) {
        Objects.requireNonNull(encryptor, "encryptor");
        KeyHandle signing = JwkKeyImporter.importKey(signingKey, KeyUse.SIGN);
        Map<String, KeyHandle> recipients = new LinkedHashMap<>();
        for (KeyDescriptor descriptor : recipientPublicKeys.keys()) {
            KeyHandle recipient = JwkKeyImporter.importKey(descriptor.toPublic(), KeyUse.WRAP);
            if (signing.family() == KeyFamily.EC && recipient.family() == KeyFamily.EC
                    && signing.curve() != recipient.curve()) {
                throw new EnvelopeException(MIXED_KEY_TYPES, "All keys must use the same curve");
            }
            recipients.put(recipient.kid(), recipient);
        }
        return new Sealer(signing, recipients, encryptor);
    }

    public String kid() {
        return signingKey.kid();
    }

    public AlgorithmSuite suite() {
        return suite;
    }

    public Set<String> recipientKids() {
        return recipientKeys.keySet();
    }

    /** Seals the UTF-8 encoding of {@code plaintext}. */
    public Envelope seal(String plaintext, List<String> recipientKids) {
        return seal(plaintext.getBytes(StandardCharsets.UTF_8), recipientKids);
    }

    /**
     * Encrypts the payload for the given recipients and signs the result.
     *
     * @param plaintext     the bytes to protect
     * @param recipientKids ids of recipients known to this sealer; duplicates are ignored
     * @return the complete envelope
     * @throws EnvelopeException {@code NO_RECIPIENTS}, {@code UNKNOWN_RECIPIENT} or
     *         {@code MIXED_KEY_TYPES} before any cryptography; {@code KEY_WRAP_FAILURE} if any
     *         recipient cannot be wrapped for
     */
    public Envelope seal(byte[] plaintext, List<String> recipientKids) {
        Objects.requireNonNull(plaintext, "plaintext");
        List<KeyHandle> recipients = selectRecipients(recipientKids);

        // Step 1: Fresh CEK, payload encrypted once
        SecretKey cek = encryptor.generateKey();
        byte[] encryptedPayload = encryptor.encrypt(plaintext, cek);
        String payload = Util.base64(encryptedPayload);

        // Step 2: Wrap the CEK for each recipient
        Map<String, String> wrappedKeys = new LinkedHashMap<>();
        for (KeyHandle recipient : recipients) {
            try {
                wrappedKeys.put(recipient.kid(), Util.base64(suite.wrapKey(cek, recipient.publicKey())));
            } catch (GeneralSecurityException | RuntimeException e) {
                throw new EnvelopeException(KEY_WRAP_FAILURE,
                        "Unable to wrap content key for recipient: " + recipient.kid(), e);
            }
        }

        // Step 3: Sign canonical {kid, cek, payload}
        byte[] signedContent = Canonicalizer.canonicalBytes(
                Envelope.signedContent(signingKey.kid(), wrappedKeys, payload));
        byte[] signature = suite.sign(signedContent, signingKey.privateKey());

        // Step 4: Commit to the payload ciphertext
        byte[] ctx = commitment.commitment(encryptedPayload);

        logger.debug("Sealed {} byte payload from {} for {} recipient(s) using {}",
                plaintext.length, signingKey.kid(), wrappedKeys.size(), suite.name());
        return new Envelope(signingKey.kid(), wrappedKeys, payload, Util.base64(signature), Util.base64(ctx));
    }

    /** All recipient-set and key-family checks, done before any key material is used. */
    private List<KeyHandle> selectRecipients(List<String> recipientKids) {
        if (recipientKids == null || recipientKids.isEmpty()) {
            throw new EnvelopeException(NO_RECIPIENTS, "No recipients specified");
        }
        Map<String, KeyHandle> selected = new LinkedHashMap<>();
        for (String kid : new LinkedHashSet<>(recipientKids)) {
            KeyHandle key = recipientKeys.get(kid);
            if (key == null) {
                throw new EnvelopeException(UNKNOWN_RECIPIENT, "Unknown recipient: " + kid);
            }
            selected.put(kid, key);
        }
        for (KeyHandle key : selected.values()) {
            if (!key.compatibleWith(signingKey)) {
                throw new EnvelopeException(MIXED_KEY_TYPES, "Mixed key types not supported");
            }
        }
        return List.copyOf(selected.values());
    }
}
