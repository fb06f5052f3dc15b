package com.docvault.crypto;

/**
 * Raised when a cryptographic operation cannot complete: no usable entropy source, a malformed
 * key or payload, or a provider error. Never converted into a default value by this package.
 */
public class CryptoFailureException extends RuntimeException {

    public CryptoFailureException(String message) {
        super(message);
    }

    public CryptoFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
