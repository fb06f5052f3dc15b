package com.docvault.crypto;

/**
 * The GCM authentication tag did not verify: the ciphertext, IV or tag was modified, or the
 * payload was encrypted under a different key. No plaintext is ever released in this case.
 */
public class TamperedOrWrongKeyException extends CryptoFailureException {

    public TamperedOrWrongKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
