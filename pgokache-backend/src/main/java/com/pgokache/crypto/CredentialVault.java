package com.pgokache.crypto;

/**
 * Encrypts instance passwords at rest.
 */
public interface CredentialVault {

    /**
     * Encrypts a plaintext password.
     *
     * @param plaintext password
     * @return opaque ciphertext
     */
    byte[] encrypt(String plaintext);

    /**
     * Decrypts ciphertext produced by {@link #encrypt(String)}.
     *
     * @param ciphertext opaque ciphertext
     * @return plaintext password
     * @throws InvalidCredentialException when the ciphertext is malformed or was encrypted with another key
     */
    String decrypt(byte[] ciphertext);
}
