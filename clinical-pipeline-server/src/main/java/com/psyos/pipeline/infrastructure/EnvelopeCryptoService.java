package com.psyos.pipeline.infrastructure;

import com.psyos.pipeline.exception.IntegrityException;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Envelope encryption: each conversation has its own AES-256 data key (DEK), stored
 * wrapped under the master key (KEK). Message bodies and attachments are encrypted
 * under the DEK. All operations are AES-256-GCM with a fresh 96-bit nonce per call.
 *
 * Wrapped keys are packed as base64(nonce) "." base64(tag) "." base64(ciphertext).
 */
@Service
public class EnvelopeCryptoService {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int NONCE_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BYTES = 16;
    private static final String DELIMITER = ".";

    private final MasterKeyProvider masterKeyProvider;
    private final SecureRandom random = new SecureRandom();

    public EnvelopeCryptoService(MasterKeyProvider masterKeyProvider) {
        this.masterKeyProvider = masterKeyProvider;
    }

    // ============================================
    // Key wrapping
    // ============================================

    public byte[] generateDataKey() {
        byte[] key = new byte[KEY_LENGTH_BYTES];
        random.nextBytes(key);
        return key;
    }

    public String wrapKey(byte[] rawKey, byte[] kek) {
        EncryptedPayload sealed = encrypt(rawKey, kek);
        return String.join(DELIMITER, sealed.nonceBase64(), sealed.tagBase64(), sealed.ciphertextBase64());
    }

    public byte[] unwrapKey(String packed, byte[] kek) {
        if (packed == null) {
            throw new IntegrityException("Invalid wrapped key format");
        }
        String[] parts = packed.split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw new IntegrityException("Invalid wrapped key format");
        }
        return decrypt(decodeBase64(parts[2]), decodeBase64(parts[0]), decodeBase64(parts[1]), kek);
    }

    /**
     * Creates a fresh conversation key and returns it wrapped under the master key.
     */
    public String newWrappedConversationKey() {
        byte[] dek = generateDataKey();
        byte[] kek = masterKeyProvider.masterKey();
        try {
            return wrapKey(dek, kek);
        } finally {
            Arrays.fill(dek, (byte) 0);
            Arrays.fill(kek, (byte) 0);
        }
    }

    public DataKey unwrapConversationKey(String encryptedDek) {
        byte[] kek = masterKeyProvider.masterKey();
        try {
            return new DataKey(unwrapKey(encryptedDek, kek));
        } finally {
            Arrays.fill(kek, (byte) 0);
        }
    }

    // ============================================
    // Data encryption
    // ============================================

    public EncryptedPayload encrypt(byte[] plaintext, byte[] key) {
        requireKey(key);
        byte[] nonce = new byte[NONCE_LENGTH_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH_BYTES * 8, nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            int ciphertextLength = sealed.length - TAG_LENGTH_BYTES;
            return new EncryptedPayload(
                    Arrays.copyOfRange(sealed, 0, ciphertextLength),
                    nonce,
                    Arrays.copyOfRange(sealed, ciphertextLength, sealed.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    public byte[] decrypt(byte[] ciphertext, byte[] nonce, byte[] tag, byte[] key) {
        requireKey(key);
        if (nonce == null || nonce.length != NONCE_LENGTH_BYTES) {
            throw new IntegrityException("Invalid nonce length");
        }
        if (tag == null || tag.length != TAG_LENGTH_BYTES) {
            throw new IntegrityException("Invalid authentication tag length");
        }
        byte[] sealed = new byte[ciphertext.length + TAG_LENGTH_BYTES];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_LENGTH_BYTES);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH_BYTES * 8, nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new IntegrityException("Authentication failed: ciphertext was tampered with or the key is wrong", e);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException("Decryption failed", e);
        }
    }

    public EncryptedPayload encryptText(String plaintext, DataKey dek) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), dek.bytes());
    }

    public String decryptText(String ciphertextB64, String nonceB64, String tagB64, DataKey dek) {
        return new String(decryptBytes(ciphertextB64, nonceB64, tagB64, dek), StandardCharsets.UTF_8);
    }

    public EncryptedPayload encryptBytes(byte[] plaintext, DataKey dek) {
        return encrypt(plaintext, dek.bytes());
    }

    public byte[] decryptBytes(String ciphertextB64, String nonceB64, String tagB64, DataKey dek) {
        return decrypt(decodeBase64(ciphertextB64), decodeBase64(nonceB64), decodeBase64(tagB64), dek.bytes());
    }

    private static void requireKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException("AES-256 key must be 32 bytes");
        }
    }

    private static byte[] decodeBase64(String value) {
        if (value == null) {
            throw new IntegrityException("Missing encrypted field");
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Encrypted field is not valid base64", e);
        }
    }
}
