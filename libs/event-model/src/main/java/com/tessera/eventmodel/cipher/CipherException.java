package com.tessera.eventmodel.cipher;

/** Thrown when encryption or decryption fails, including authentication failures. */
public class CipherException extends RuntimeException {

    public CipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
