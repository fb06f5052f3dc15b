package com.docvault.crypto;

/**
 * Output of AES-256-GCM encryption, split the way it is persisted.
 * All byte fields are Base64 (standard alphabet).
 */
public record EncryptedPayload(
        String iv,          // 96-bit nonce, fresh per encryption
        String ciphertext,  // ciphertext without the tag
        String tag,         // 128-bit authentication tag
        String algorithm
) {

    public boolean isComplete() {
        return iv != null && !iv.isEmpty()
                && ciphertext != null
                && tag != null && !tag.isEmpty();
    }
}
