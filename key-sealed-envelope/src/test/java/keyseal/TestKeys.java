package keyseal;

import keyseal.crypto.AlgorithmSuite;
import keyseal.keys.JwkKeyImporter;
import keyseal.keys.KeyDescriptor;
import keyseal.keys.KeyUse;

import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Generates private JWKs for tests.
 */
public final class TestKeys {

    private TestKeys() {}

    public static KeyDescriptor signingKey(AlgorithmSuite suite, String kid) {
        return KeyDescriptor.fromKeyPair(kid, suite.signer().generateKeyPair());
    }

    public static KeyDescriptor recipientKey(AlgorithmSuite suite, String kid) {
        return KeyDescriptor.fromKeyPair(kid, suite.keyWrapper().generateRecipientKeyPair());
    }

    public static PrivateKey privateKey(KeyDescriptor jwk, KeyUse use) {
        return JwkKeyImporter.importKey(jwk, use).privateKey();
    }

    public static PublicKey publicKey(KeyDescriptor jwk, KeyUse use) {
        return JwkKeyImporter.importKey(jwk.toPublic(), use).publicKey();
    }
}
