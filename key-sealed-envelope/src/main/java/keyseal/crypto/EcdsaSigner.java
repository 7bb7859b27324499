package keyseal.crypto;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;

/**
 * ECDSA signing with SHA-256 on P-256 or P-384.
 * Signatures use the fixed-length {@code r || s} (IEEE P1363) encoding, as WebCrypto does,
 * rather than the JCA default DER.
 */
public class EcdsaSigner implements Signer {

    private static final String ALGORITHM = "SHA256withECDSAinP1363Format";

    private final EcCurve curve;

    public EcdsaSigner(EcCurve curve) {
        this.curve = curve;
    }

    public EcCurve curve() {
        return curve;
    }

    @Override
    public String algorithmName() {
        return "ECDSA-" + curve.jwkName();
    }

    @Override
    public KeyPair generateKeyPair() {
        return curve.generateKeyPair();
    }

    @Override
    public byte[] sign(byte[] data, PrivateKey privateKey) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(privateKey);
            sig.update(data);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ECDSA signing failed", e);
        }
    }

    @Override
    public boolean verify(byte[] data, byte[] signature, PublicKey publicKey) {
        if (signature.length != 2 * curve.fieldBytes()) {
            return false;
        }
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(publicKey);
            sig.update(data);
            return sig.verify(signature);
        } catch (SignatureException | InvalidKeyException e) {
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ECDSA unavailable", e);
        }
    }
}
