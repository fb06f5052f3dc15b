package com.docvault.store;

/**
 * The supplied password cannot unlock the store's master key, or the store is password protected
 * and no password was given. Recoverable: the caller can ask the user again.
 */
public class InvalidPasswordException extends RuntimeException {

    public InvalidPasswordException(String message) {
        super(message);
    }
}
