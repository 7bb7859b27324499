package keyseal.crypto;

import java.util.List;

/**
 * Pre-configured algorithm suites.
 */
public final class Suites {

    private Suites() {}

    /** RSA-2048 PSS + RSA-OAEP. */
    public static final AlgorithmSuite RSA = new RsaSuite(2048);

    /** ECDSA P-256 + ECDH P-256. */
    public static final AlgorithmSuite EC_P256 = new EcSuite(EcCurve.P_256);

    /** ECDSA P-384 + ECDH P-384. */
    public static final AlgorithmSuite EC_P384 = new EcSuite(EcCurve.P_384);

    /** The suite for keys of the given family (and curve, for EC). */
    public static AlgorithmSuite forFamily(KeyFamily family, EcCurve curve) {
        switch (family) {
            case RSA:
                return RSA;
            case EC:
                if (curve == null) {
                    throw new IllegalArgumentException("EC suites need a curve");
                }
                return curve == EcCurve.P_384 ? EC_P384 : EC_P256;
            default:
                throw new IllegalArgumentException("Unknown key family: " + family);
        }
    }

    /** All suites in order. */
    public static List<AlgorithmSuite> all() {
        return List.of(RSA, EC_P256, EC_P384);
    }
}
