package keyseal.crypto;

import java.util.Optional;

/**
 * ECDSA signatures with ephemeral-ECDH key wrapping, all on one curve.
 */
public record EcSuite(EcCurve ecCurve, EcdsaSigner signer, EcdhKeyWrapper keyWrapper) implements AlgorithmSuite {

    public EcSuite(EcCurve ecCurve) {
        this(ecCurve, new EcdsaSigner(ecCurve), new EcdhKeyWrapper(ecCurve));
    }

    @Override
    public String name() {
        return "EC_" + ecCurve.jwkName().replace("-", "");
    }

    @Override
    public KeyFamily family() {
        return KeyFamily.EC;
    }

    @Override
    public Optional<EcCurve> curve() {
        return Optional.of(ecCurve);
    }
}
