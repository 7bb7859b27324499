package keyseal.crypto;

import java.util.Optional;

/**
 * RSA-PSS signatures with RSA-OAEP key wrapping.
 */
public record RsaSuite(RsaPssSigner signer, RsaOaepKeyWrapper keyWrapper) implements AlgorithmSuite {

    public RsaSuite() {
        this(2048);
    }

    /** @param keySize modulus size for generated keys; imported keys may have any size */
    public RsaSuite(int keySize) {
        this(new RsaPssSigner(keySize), new RsaOaepKeyWrapper(keySize));
    }

    @Override
    public String name() {
        return "RSA";
    }

    @Override
    public KeyFamily family() {
        return KeyFamily.RSA;
    }

    @Override
    public Optional<EcCurve> curve() {
        return Optional.empty();
    }
}
