package keyseal;

/**
 * Failure raised while creating, sealing, parsing or unsealing an envelope.
 * The {@link Reason} identifies which protocol check failed.
 */
public class EnvelopeException extends RuntimeException {

    /** Every way a seal or unseal call can fail. */
    public enum Reason {
        NO_RECIPIENTS(false),
        UNKNOWN_RECIPIENT(false),
        UNKNOWN_SENDER(false),
        MIXED_KEY_TYPES(false),
        UNSUPPORTED_KEY_TYPE(false),
        KEY_IMPORT_FAILURE(false),
        KEY_WRAP_FAILURE(false),
        MALFORMED_ENVELOPE(false),
        NO_CEK_FOR_RECIPIENT(false),
        INVALID_SIGNATURE(true),
        KEY_UNWRAP_FAILURE(true),
        INVALID_COMMITMENT(true),
        AUTHENTICATION_FAILURE(true),
        /** Redacted form of any verification failure. */
        ENVELOPE_REJECTED(true);

        private final boolean verificationFailure;

        Reason(boolean verificationFailure) {
            this.verificationFailure = verificationFailure;
        }

        /** True for the cryptographic rejections: signature, unwrap, commitment and AEAD tag. */
        public boolean isVerificationFailure() {
            return verificationFailure;
        }
    }

    private final Reason reason;

    public EnvelopeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EnvelopeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
