package keyseal.canonical;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Deterministic JSON serialization following RFC 8785 (JSON Canonicalization Scheme).
 * Independent implementations that canonicalize the same object graph produce the same bytes, which
 * is what makes the envelope signature portable.
 *
 * Supported values: {@link Map} with string keys, {@link List}, {@link String}, {@link Boolean},
 * {@code null}, and integral numbers up to 2<sup>53</sup> in magnitude. Object members are sorted
 * by the UTF-16 code units of their names; strings use the minimal escaping of ECMAScript
 * {@code JSON.stringify}.
 */
public final class Canonicalizer {

    private static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

    private Canonicalizer() {}

    public static String canonicalize(Object value) {
        StringBuilder sb = new StringBuilder();
        write(sb, value);
        return sb.toString();
    }

    public static byte[] canonicalBytes(Object value) {
        return canonicalize(value).getBytes(StandardCharsets.UTF_8);
    }

    private static void write(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String) {
            writeString(sb, (String) value);
        } else if (value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Number) {
            writeNumber(sb, (Number) value);
        } else if (value instanceof Map) {
            writeObject(sb, (Map<?, ?>) value);
        } else if (value instanceof List) {
            writeArray(sb, (List<?>) value);
        } else {
            throw new IllegalArgumentException("Cannot canonicalize " + value.getClass().getName());
        }
    }

    private static void writeObject(StringBuilder sb, Map<?, ?> map) {
        List<String> names = new ArrayList<>(map.size());
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new IllegalArgumentException("Object member names must be strings");
            }
            names.add((String) key);
        }
        // String.compareTo orders by UTF-16 code units
        Collections.sort(names);
        sb.append('{');
        boolean first = true;
        for (String name : names) {
            if (!first) sb.append(',');
            first = false;
            writeString(sb, name);
            sb.append(':');
            write(sb, map.get(name));
        }
        sb.append('}');
    }

    private static void writeArray(StringBuilder sb, List<?> list) {
        sb.append('[');
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) sb.append(',');
            write(sb, list.get(i));
        }
        sb.append(']');
    }

    private static void writeNumber(StringBuilder sb, Number number) {
        long asLong;
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                throw new IllegalArgumentException("Only integral numbers can be canonicalized: " + number);
            }
            asLong = (long) d;
        } else {
            asLong = number.longValue();
        }
        if (Math.abs(asLong) > MAX_SAFE_INTEGER) {
            throw new IllegalArgumentException("Number exceeds 2^53: " + number);
        }
        sb.append(asLong);
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else if (Character.isHighSurrogate(c) && i + 1 < s.length()
                            && Character.isLowSurrogate(s.charAt(i + 1))) {
                        sb.append(c).append(s.charAt(++i));
                    } else if (Character.isSurrogate(c)) {
                        // Unpaired surrogates have no UTF-8 form; escape them like JSON.stringify
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }
}
