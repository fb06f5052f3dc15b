package com.docvault.crypto;

import java.time.Instant;

/** X25519 key pair, both halves Base64 encoded. */
public record KeyPairMaterial(
        String keyId,
        String publicKey,
        String privateKey,
        String algorithm,
        Instant createdAt
) {}
