package keyseal.crypto;

/**
 * Asymmetric algorithm family of a key. All keys used in one seal or unseal call share a family.
 */
public enum KeyFamily {
    RSA,
    EC
}
