package com.docvault.crypto;

/**
 * Salted, iterated password hash. The salt and iteration count travel with the hash so a
 * verifier never has to guess them.
 */
public record PasswordHash(
        String hash,
        String salt,
        String algorithm,
        int iterations
) {}
