package keyseal.model;

import com.grack.nanojson.JsonBuilder;
import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;
import keyseal.EnvelopeException;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static keyseal.EnvelopeException.Reason.MALFORMED_ENVELOPE;

/**
 * Reads and writes the envelope wire shape:
 * <pre>
 * { "kid": string, "cek": { [recipientKeyId]: base64 }, "payload": base64, "signature": base64, "ctx": base64 }
 * </pre>
 */
public final class EnvelopeJson {

    private EnvelopeJson() {}

    public static String toJson(Envelope envelope) {
        JsonBuilder<JsonObject> cek = JsonObject.builder();
        envelope.cek().forEach(cek::value);
        JsonObject json = JsonObject.builder()
                .value("kid", envelope.kid())
                .value("cek", cek.done())
                .value("payload", envelope.payload())
                .value("signature", envelope.signature())
                .value("ctx", envelope.ctx())
                .done();
        return JsonWriter.string(json);
    }

    public static byte[] toBytes(Envelope envelope) {
        return toJson(envelope).getBytes(StandardCharsets.UTF_8);
    }

    public static Envelope fromBytes(byte[] json) {
        return fromJson(new String(json, StandardCharsets.UTF_8));
    }

    /**
     * @throws EnvelopeException with {@code MALFORMED_ENVELOPE} if the document is not an envelope
     */
    public static Envelope fromJson(String json) {
        JsonObject object;
        try {
            object = JsonParser.object().from(json);
        } catch (JsonParserException e) {
            throw new EnvelopeException(MALFORMED_ENVELOPE, "Envelope is not a JSON object", e);
        }

        Object cekValue = object.get("cek");
        if (!(cekValue instanceof JsonObject)) {
            throw new EnvelopeException(MALFORMED_ENVELOPE, "Envelope field 'cek' must be an object");
        }
        Map<String, String> cek = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : ((JsonObject) cekValue).entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                throw new EnvelopeException(MALFORMED_ENVELOPE,
                        "Wrapped CEK for '" + entry.getKey() + "' must be a string");
            }
            cek.put(entry.getKey(), (String) entry.getValue());
        }
        if (cek.isEmpty()) {
            throw new EnvelopeException(MALFORMED_ENVELOPE, "Envelope has no recipients");
        }

        return new Envelope(
                requireString(object, "kid"),
                cek,
                requireString(object, "payload"),
                requireString(object, "signature"),
                requireString(object, "ctx"));
    }

    private static String requireString(JsonObject object, String field) {
        Object value = object.get(field);
        if (!(value instanceof String)) {
            throw new EnvelopeException(MALFORMED_ENVELOPE, "Envelope field '" + field + "' must be a string");
        }
        return (String) value;
    }
}
