package keyseal.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The sealed envelope: one encrypted payload, a wrapped CEK per recipient, the sender's signature
 * over {@code {kid, cek, payload}} and the ciphertext commitment.
 *
 * @param kid       id of the sender's signing key
 * @param cek       recipient key id to base64 wrapped CEK, in insertion order
 * @param payload   base64 of {@code IV || ciphertext || tag}
 * @param signature base64 signature over the canonical signed content
 * @param ctx       base64 commitment tag
 */
public record Envelope(
        String kid,
        Map<String, String> cek,
        String payload,
        String signature,
        String ctx
) {
    public Envelope {
        Objects.requireNonNull(kid, "kid");
        Objects.requireNonNull(cek, "cek");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(ctx, "ctx");
        cek = Collections.unmodifiableMap(new LinkedHashMap<>(cek));
    }

    /** The object that is canonicalized and signed. Never includes {@code ctx}. */
    public Map<String, Object> signedContent() {
        return signedContent(kid, cek, payload);
    }

    public static Map<String, Object> signedContent(String kid, Map<String, String> cek, String payload) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("kid", kid);
        content.put("cek", cek);
        content.put("payload", payload);
        return content;
    }

    public Envelope withKid(String newKid) {
        return new Envelope(newKid, cek, payload, signature, ctx);
    }

    public Envelope withCek(Map<String, String> newCek) {
        return new Envelope(kid, newCek, payload, signature, ctx);
    }

    public Envelope withPayload(String newPayload) {
        return new Envelope(kid, cek, newPayload, signature, ctx);
    }

    public Envelope withSignature(String newSignature) {
        return new Envelope(kid, cek, payload, newSignature, ctx);
    }

    public Envelope withCtx(String newCtx) {
        return new Envelope(kid, cek, payload, signature, newCtx);
    }
}
