package keyseal.keys;

import keyseal.EnvelopeException;
import keyseal.crypto.EcCurve;
import keyseal.crypto.KeyFamily;
import keyseal.model.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.spec.ECPrivateKeySpec;
import java.security.spec.KeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPrivateKeySpec;
import java.security.spec.RSAPublicKeySpec;

import static keyseal.EnvelopeException.Reason.KEY_IMPORT_FAILURE;
import static keyseal.EnvelopeException.Reason.UNSUPPORTED_KEY_TYPE;

/**
 * Imports JWK descriptors into JCA keys.
 */
public final class JwkKeyImporter {

    private static final Logger logger = LoggerFactory.getLogger(JwkKeyImporter.class);

    private JwkKeyImporter() {}

    /**
     * @param descriptor the JWK to import
     * @param use        the capability required; private uses need the {@code d} member
     * @return a handle carrying the kid, family, curve and JCA key
     * @throws EnvelopeException with {@code UNSUPPORTED_KEY_TYPE} for an unknown {@code kty} or
     *         {@code crv}, or {@code KEY_IMPORT_FAILURE} when the key material is missing or invalid
     */
    public static KeyHandle importKey(KeyDescriptor descriptor, KeyUse use) {
        KeyFamily family = family(descriptor);
        EcCurve curve = null;
        if (family == KeyFamily.EC) {
            curve = EcCurve.fromJwkName(descriptor.crv())
                    .orElseThrow(() -> new EnvelopeException(UNSUPPORTED_KEY_TYPE,
                            "Unsupported curve for key " + descriptor.kid() + ": " + descriptor.crv()));
        }
        if (use.needsPrivateKey() && !descriptor.isPrivate()) {
            throw new EnvelopeException(KEY_IMPORT_FAILURE,
                    "Key " + descriptor.kid() + " must be a private key to " + use.name().toLowerCase());
        }

        Key key;
        try {
            key = family == KeyFamily.RSA ? importRsa(descriptor, use) : importEc(descriptor, curve, use);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new EnvelopeException(KEY_IMPORT_FAILURE, "Unable to import key " + descriptor.kid(), e);
        }
        logger.debug("Imported {} key {} for {}", family, descriptor.kid(), use);
        return new KeyHandle(descriptor.kid(), family, curve, use, key);
    }

    private static KeyFamily family(KeyDescriptor descriptor) {
        switch (descriptor.kty()) {
            case "RSA":
                return KeyFamily.RSA;
            case "EC":
                return KeyFamily.EC;
            default:
                throw new EnvelopeException(UNSUPPORTED_KEY_TYPE,
                        "Unsupported key type for key " + descriptor.kid() + ": " + descriptor.kty());
        }
    }

    private static Key importRsa(KeyDescriptor jwk, KeyUse use) throws GeneralSecurityException {
        BigInteger n = required(jwk, "n", jwk.n());
        KeyFactory kf = KeyFactory.getInstance("RSA");
        if (!use.needsPrivateKey()) {
            return kf.generatePublic(new RSAPublicKeySpec(n, required(jwk, "e", jwk.e())));
        }
        BigInteger d = required(jwk, "d", jwk.d());
        KeySpec spec;
        if (jwk.p() != null && jwk.q() != null && jwk.dp() != null && jwk.dq() != null && jwk.qi() != null) {
            spec = new RSAPrivateCrtKeySpec(n, required(jwk, "e", jwk.e()), d,
                    unsigned(jwk.p()), unsigned(jwk.q()), unsigned(jwk.dp()), unsigned(jwk.dq()), unsigned(jwk.qi()));
        } else {
            spec = new RSAPrivateKeySpec(n, d);
        }
        return kf.generatePrivate(spec);
    }

    private static Key importEc(KeyDescriptor jwk, EcCurve curve, KeyUse use) throws GeneralSecurityException {
        if (use.needsPrivateKey()) {
            BigInteger s = required(jwk, "d", jwk.d());
            return KeyFactory.getInstance("EC").generatePrivate(new ECPrivateKeySpec(s, curve.parameterSpec()));
        }
        return curve.toPublicKey(required(jwk, "x", jwk.x()), required(jwk, "y", jwk.y()));
    }

    private static BigInteger required(KeyDescriptor jwk, String member, String value) throws GeneralSecurityException {
        if (value == null || value.isEmpty()) {
            throw new GeneralSecurityException("Key " + jwk.kid() + " is missing member '" + member + "'");
        }
        return unsigned(value);
    }

    private static BigInteger unsigned(String base64url) {
        return new BigInteger(1, Util.unbase64url(base64url));
    }
}
