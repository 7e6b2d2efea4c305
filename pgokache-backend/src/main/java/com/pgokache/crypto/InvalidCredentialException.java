package com.pgokache.crypto;

/**
 * Thrown when a stored password cannot be decrypted with the current key.
 */
public class InvalidCredentialException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying crypto failure
     */
    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidCredentialException(String message) {
        super(message);
    }
}
