package com.psyos.pipeline.infrastructure;

import com.psyos.pipeline.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Holds the master key-encryption key, loaded once from configuration at startup.
 * The KEK only ever wraps and unwraps conversation data keys.
 */
@Component
@Slf4j
public class MasterKeyProvider {

    static final int KEY_LENGTH_BYTES = 32;

    private final byte[] kek;

    public MasterKeyProvider(@Value("${crypto.master-kek-b64:}") String encodedKek) {
        this.kek = decode(encodedKek);
        log.info("Master KEK loaded ({} bytes)", kek.length);
    }

    public static MasterKeyProvider fromBase64(String encodedKek) {
        return new MasterKeyProvider(encodedKek);
    }

    /**
     * Copy of the KEK; callers must not keep it.
     */
    public byte[] masterKey() {
        return kek.clone();
    }

    private static byte[] decode(String encodedKek) {
        if (encodedKek == null || encodedKek.isBlank()) {
            throw new ConfigurationException("crypto.master-kek-b64 is not configured");
        }
        byte[] key;
        try {
            key = Base64.getDecoder().decode(encodedKek.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("crypto.master-kek-b64 is not valid base64", e);
        }
        if (key.length != KEY_LENGTH_BYTES) {
            throw new ConfigurationException("crypto.master-kek-b64 must decode to 32 bytes");
        }
        return key;
    }
}
