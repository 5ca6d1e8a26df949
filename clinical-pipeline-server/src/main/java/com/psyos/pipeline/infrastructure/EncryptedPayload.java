package com.psyos.pipeline.infrastructure;

import lombok.Value;

import java.util.Base64;

/**
 * AES-GCM output split into its three parts.
 */
@Value
public class EncryptedPayload {

    byte[] ciphertext;
    byte[] nonce;
    byte[] tag;

    public String ciphertextBase64() {
        return Base64.getEncoder().encodeToString(ciphertext);
    }

    public String nonceBase64() {
        return Base64.getEncoder().encodeToString(nonce);
    }

    public String tagBase64() {
        return Base64.getEncoder().encodeToString(tag);
    }
}
