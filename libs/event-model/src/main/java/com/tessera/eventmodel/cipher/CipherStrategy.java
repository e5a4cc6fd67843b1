package com.tessera.eventmodel.cipher;

/**
 * Symmetric encryption of event payloads. The key is bound when the strategy is constructed.
 *
 * <p>Authenticated schemes are preferred: a forged or altered ciphertext then fails in {@link
 * #decrypt} rather than decoding to garbage.
 */
public interface CipherStrategy {

    /** Encrypts the plaintext. Two calls with the same input should not produce the same output. */
    byte[] encrypt(byte[] plaintext);

    /**
     * Decrypts ciphertext produced by {@link #encrypt}.
     *
     * @throws CipherException if the ciphertext cannot be authenticated or decrypted
     */
    byte[] decrypt(byte[] ciphertext);
}
