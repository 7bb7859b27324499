package keyseal.keys;

/**
 * What an imported key will be used for. Private uses require the JWK's {@code d} member.
 */
public enum KeyUse {
    SIGN(true),
    VERIFY(false),
    WRAP(false),
    UNWRAP(true);

    private final boolean needsPrivateKey;

    KeyUse(boolean needsPrivateKey) {
        this.needsPrivateKey = needsPrivateKey;
    }

    public boolean needsPrivateKey() {
        return needsPrivateKey;
    }
}
