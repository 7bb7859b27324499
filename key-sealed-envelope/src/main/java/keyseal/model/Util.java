package keyseal.model;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

/**
 * Shared byte helpers: concatenation, slicing, base64 and constant-time comparison.
 */
public final class Util {

    private Util() {}

    private static final Base64.Encoder BASE64 = Base64.getEncoder();
    private static final Base64.Decoder BASE64_DECODER = Base64.getDecoder();
    private static final Base64.Decoder BASE64URL_DECODER = Base64.getUrlDecoder();

    public static byte[] concat(byte[]... arrays) {
        int total = 0;
        for (byte[] a : arrays) total += a.length;
        byte[] result = new byte[total];
        int offset = 0;
        for (byte[] a : arrays) {
            System.arraycopy(a, 0, result, offset, a.length);
            offset += a.length;
        }
        return result;
    }

    public static byte[] slice(byte[] data, int from, int to) {
        return Arrays.copyOfRange(data, from, to);
    }

    public static String base64(byte[] data) {
        return BASE64.encodeToString(data);
    }

    /**
     * Decodes standard base64.
     * @throws IllegalArgumentException if the input is not valid base64
     */
    public static byte[] unbase64(String s) {
        return BASE64_DECODER.decode(s);
    }

    /** Decodes unpadded base64url, as used by JWK members. */
    public static byte[] unbase64url(String s) {
        return BASE64URL_DECODER.decode(s);
    }

    public static String base64url(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    /** Constant-time equality. */
    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        return MessageDigest.isEqual(a, b);
    }

    /** Overwrites sensitive bytes with zeros; nulls are ignored. */
    public static void wipe(byte[]... sensitiveData) {
        for (byte[] data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }
}
