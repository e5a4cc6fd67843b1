package com.tessera.eventmodel.cipher;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES in GCM mode with a fresh 12-byte nonce per message.
 *
 * <p>Output layout: {@code nonce || ciphertext || 16-byte tag}. Decryption fails with {@link
 * CipherException} when the key is wrong or any byte was altered.
 */
public final class AesGcmCipherStrategy implements CipherStrategy {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final SecretKey key;
    private final SecureRandom random;

    /**
     * Creates a strategy bound to the given AES key.
     *
     * @param key a 128, 192 or 256-bit AES key
     */
    public AesGcmCipherStrategy(SecretKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (!"AES".equalsIgnoreCase(key.getAlgorithm())) {
            throw new IllegalArgumentException("key must be an AES key");
        }
        int length = key.getEncoded().length;
        if (length != 16 && length != 24 && length != 32) {
            throw new IllegalArgumentException("AES key must be 16, 24 or 32 bytes, got " + length);
        }
        this.key = key;
        this.random = new SecureRandom();
    }

    /** Creates a strategy from a Base64-encoded key, as held in configuration. */
    public static AesGcmCipherStrategy fromBase64Key(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalArgumentException("base64Key must not be null or blank");
        }
        byte[] raw = Base64.getDecoder().decode(base64Key.trim());
        return new AesGcmCipherStrategy(new SecretKeySpec(raw, "AES"));
    }

    /** Generates a random 256-bit key, Base64-encoded. */
    public static String generateBase64Key() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(256);
            return Base64.getEncoder().encodeToString(generator.generateKey().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES key generation is not available", e);
        }
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(NONCE_LENGTH + sealed.length).put(nonce).put(sealed).array();
        } catch (GeneralSecurityException e) {
            throw new CipherException("Encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) {
        if (ciphertext.length < NONCE_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new CipherException("Ciphertext is too short", null);
        }
        byte[] nonce = Arrays.copyOfRange(ciphertext, 0, NONCE_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return cipher.doFinal(ciphertext, NONCE_LENGTH, ciphertext.length - NONCE_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new CipherException("Decryption failed", e);
        }
    }
}
