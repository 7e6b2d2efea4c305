package com.pgokache.crypto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM vault keyed by a local key file.
 *
 * <p>The key file is created on first use. Ciphertext layout: 12-byte IV followed by the GCM
 * output (ciphertext and 16-byte tag).
 */
@Slf4j
@Component
public class AesGcmCredentialVault implements CredentialVault {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BITS = 256;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final Path keyFile;
    private final SecureRandom random = new SecureRandom();
    private volatile SecretKey key;

    @Autowired
    public AesGcmCredentialVault(@Value("${pgokache.crypto.key-file:.secrets/key.bin}") String keyFile) {
        this(Path.of(keyFile));
    }

    public AesGcmCredentialVault(Path keyFile) {
        this.keyFile = keyFile;
    }

    @Override
    public byte[] encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("password is required");
        }
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key(), new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed).array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt credential", e);
        }
    }

    @Override
    public String decrypt(byte[] ciphertext) {
        if (ciphertext == null || ciphertext.length <= IV_BYTES) {
            throw new InvalidCredentialException("credential ciphertext is missing or truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key(), new GCMParameterSpec(TAG_BITS, ciphertext, 0, IV_BYTES));
            byte[] plain = cipher.doFinal(ciphertext, IV_BYTES, ciphertext.length - IV_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new InvalidCredentialException("credential was not encrypted with the current key", e);
        } catch (GeneralSecurityException e) {
            throw new InvalidCredentialException("credential could not be decrypted", e);
        }
    }

    private SecretKey key() {
        SecretKey k = key;
        if (k == null) {
            synchronized (this) {
                if (key == null) {
                    key = loadOrCreateKey();
                }
                k = key;
            }
        }
        return k;
    }

    private SecretKey loadOrCreateKey() {
        try {
            if (Files.exists(keyFile)) {
                byte[] raw = Files.readAllBytes(keyFile);
                if (raw.length != KEY_BITS / 8) {
                    throw new IllegalStateException("Key file has unexpected length: " + keyFile);
                }
                return new SecretKeySpec(raw, "AES");
            }

            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(KEY_BITS, random);
            SecretKey generated = generator.generateKey();

            Path parent = keyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(keyFile, generated.getEncoded());
            try {
                Files.setPosixFilePermissions(keyFile, PosixFilePermissions.fromString("rw-------"));
            } catch (UnsupportedOperationException e) {
                log.debug("POSIX permissions not supported for key file: {}", keyFile);
            }
            log.info("Generated new credential key file: {}", keyFile);
            return generated;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read or create key file: " + keyFile, e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES key generation is not available", e);
        }
    }
}
