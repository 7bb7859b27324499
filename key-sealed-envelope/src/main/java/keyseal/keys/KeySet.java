package keyseal.keys;

import com.grack.nanojson.JsonArray;
import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;
import keyseal.EnvelopeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static keyseal.EnvelopeException.Reason.KEY_IMPORT_FAILURE;

/**
 * A collection of named keys, the {@code { "keys": [...] }} JWKS shape.
 */
public record KeySet(List<KeyDescriptor> keys) {

    public KeySet {
        keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    }

    public static KeySet of(KeyDescriptor... keys) {
        return new KeySet(List.of(keys));
    }

    /**
     * Parses either a JSON array of JWKs or a {@code { "keys": [...] }} document.
     * @throws EnvelopeException with {@code KEY_IMPORT_FAILURE} on malformed input
     */
    public static KeySet parse(String json) {
        Object root;
        try {
            root = JsonParser.any().from(json);
        } catch (JsonParserException e) {
            throw new EnvelopeException(KEY_IMPORT_FAILURE, "Key set is not valid JSON", e);
        }
        JsonArray array;
        if (root instanceof JsonArray) {
            array = (JsonArray) root;
        } else if (root instanceof JsonObject && ((JsonObject) root).get("keys") instanceof JsonArray) {
            array = (JsonArray) ((JsonObject) root).get("keys");
        } else {
            throw new EnvelopeException(KEY_IMPORT_FAILURE, "Key set must be an array or have a 'keys' array");
        }
        List<KeyDescriptor> keys = new ArrayList<>(array.size());
        for (Object element : array) {
            if (!(element instanceof JsonObject)) {
                throw new EnvelopeException(KEY_IMPORT_FAILURE, "Key set entries must be JSON objects");
            }
            JsonObject jwk = (JsonObject) element;
            if (jwk.getString("kid") == null || jwk.getString("kty") == null) {
                throw new EnvelopeException(KEY_IMPORT_FAILURE, "Every key needs a 'kid' and a 'kty'");
            }
            keys.add(KeyDescriptor.fromJson(jwk));
        }
        return new KeySet(keys);
    }

    public KeySet toPublic() {
        return new KeySet(keys.stream().map(KeyDescriptor::toPublic).toList());
    }

    public String toJson() {
        JsonArray array = new JsonArray();
        for (KeyDescriptor key : keys) {
            array.add(key.toJson());
        }
        return JsonWriter.string(JsonObject.builder().value("keys", array).done());
    }
}
