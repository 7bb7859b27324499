package keyseal.crypto;

import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.asn1.x9.X9ECParameters;

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.util.Optional;

/**
 * Named NIST curves supported for ECDSA signing and ECDH key wrapping.
 * Knows its JWK name, its JCA name and the size of its uncompressed point encoding.
 */
public enum EcCurve {
    P_256("P-256", "secp256r1", 32),
    P_384("P-384", "secp384r1", 48);

    private final String jwkName;
    private final String jcaName;
    private final int fieldBytes;

    EcCurve(String jwkName, String jcaName, int fieldBytes) {
        this.jwkName = jwkName;
        this.jcaName = jcaName;
        this.fieldBytes = fieldBytes;
    }

    public String jwkName() {
        return jwkName;
    }

    public String jcaName() {
        return jcaName;
    }

    public int fieldBytes() {
        return fieldBytes;
    }

    /** Length of {@code 0x04 || x || y}: 65 bytes for P-256, 97 for P-384. */
    public int uncompressedPointLength() {
        return 1 + 2 * fieldBytes;
    }

    public static Optional<EcCurve> fromJwkName(String name) {
        for (EcCurve curve : values()) {
            if (curve.jwkName.equals(name)) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }

    /** Identifies the curve of a JCA EC key by its field size. */
    public static Optional<EcCurve> of(ECParameterSpec params) {
        int bits = params.getCurve().getField().getFieldSize();
        for (EcCurve curve : values()) {
            if (curve.fieldBytes * 8 == bits) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }

    public ECParameterSpec parameterSpec() {
        try {
            AlgorithmParameters params = AlgorithmParameters.getInstance("EC");
            params.init(new ECGenParameterSpec(jcaName));
            return params.getParameterSpec(ECParameterSpec.class);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC parameters unavailable for " + jwkName, e);
        }
    }

    public KeyPair generateKeyPair() {
        try {
            KeyPairGenerator kpg = KeyPairGenerator.getInstance("EC");
            kpg.initialize(new ECGenParameterSpec(jcaName));
            return kpg.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    /** Encode an EC public key as an uncompressed point (0x04 || x || y). */
    public byte[] encodeUncompressed(ECPublicKey pub) {
        byte[] x = toFixedBytes(pub.getW().getAffineX(), fieldBytes);
        byte[] y = toFixedBytes(pub.getW().getAffineY(), fieldBytes);
        byte[] result = new byte[uncompressedPointLength()];
        result[0] = 0x04;
        System.arraycopy(x, 0, result, 1, fieldBytes);
        System.arraycopy(y, 0, result, 1 + fieldBytes, fieldBytes);
        return result;
    }

    /**
     * Decode an uncompressed point into a public key on this curve.
     * BouncyCastle rejects encodings that are not points on the curve.
     */
    public PublicKey decodeUncompressed(byte[] encoded) throws GeneralSecurityException {
        if (encoded.length != uncompressedPointLength() || encoded[0] != 0x04) {
            throw new GeneralSecurityException("Not an uncompressed " + jwkName + " point");
        }
        X9ECParameters x9 = ECNamedCurveTable.getByName(jcaName);
        org.bouncycastle.math.ec.ECPoint point;
        try {
            point = x9.getCurve().decodePoint(encoded).normalize();
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Invalid " + jwkName + " point", e);
        }
        return toPublicKey(point.getAffineXCoord().toBigInteger(), point.getAffineYCoord().toBigInteger());
    }

    /** Builds a public key from affine coordinates after checking the point is on the curve. */
    public PublicKey toPublicKey(BigInteger x, BigInteger y) throws GeneralSecurityException {
        X9ECParameters x9 = ECNamedCurveTable.getByName(jcaName);
        try {
            org.bouncycastle.math.ec.ECPoint point = x9.getCurve().createPoint(x, y);
            if (!point.isValid()) {
                throw new GeneralSecurityException("Point is not on " + jwkName);
            }
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Invalid " + jwkName + " coordinates", e);
        }
        return KeyFactory.getInstance("EC").generatePublic(
                new ECPublicKeySpec(new ECPoint(x, y), parameterSpec()));
    }

    /** Convert a BigInteger to a fixed-length byte array (pad or trim leading zeros). */
    static byte[] toFixedBytes(BigInteger val, int len) {
        byte[] raw = val.toByteArray();
        if (raw.length == len) return raw;
        byte[] result = new byte[len];
        if (raw.length > len) {
            System.arraycopy(raw, raw.length - len, result, 0, len);
        } else {
            System.arraycopy(raw, 0, result, len - raw.length, raw.length);
        }
        return result;
    }
}
