package com.docvault.crypto;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the primitives in {@link CryptoService}. No Spring context.
 */
class CryptoServiceTest {

    private CryptoService crypto;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        crypto = new CryptoService(1_000, clock);
    }

    // ─── AES-GCM ─────────────────────────────────────────────────────────────

    @Test
    void encryptDecryptRoundTrip() {
        byte[] key = crypto.generateSymmetricKey();

        EncryptedPayload payload = crypto.encrypt("Quarterly figures, draft 3", key);

        assertEquals(CryptoService.AES_GCM, payload.algorithm());
        assertEquals(12, Base64.getDecoder().decode(payload.iv()).length);
        assertEquals(16, Base64.getDecoder().decode(payload.tag()).length);
        assertEquals("Quarterly figures, draft 3", crypto.decryptToString(payload, key));
    }

    @Test
    void freshIvPerEncryption() {
        byte[] key = crypto.generateSymmetricKey();

        EncryptedPayload first = crypto.encrypt("same text", key);
        EncryptedPayload second = crypto.encrypt("same text", key);

        assertNotEquals(first.iv(), second.iv());
        assertNotEquals(first.ciphertext(), second.ciphertext());
    }

    @Test
    void decryptWithWrongKeyFailsClosed() {
        EncryptedPayload payload = crypto.encrypt("secret", crypto.generateSymmetricKey());

        assertThrows(TamperedOrWrongKeyException.class,
                () -> crypto.decrypt(payload, crypto.generateSymmetricKey()));
    }

    @Test
    void flippedCiphertextBitIsDetected() {
        byte[] key = crypto.generateSymmetricKey();
        EncryptedPayload payload = crypto.encrypt("do not alter me", key);

        byte[] ciphertext = Base64.getDecoder().decode(payload.ciphertext());
        ciphertext[0] ^= 0x01;
        EncryptedPayload tampered = new EncryptedPayload(
                payload.iv(), Base64.getEncoder().encodeToString(ciphertext), payload.tag(), payload.algorithm());

        assertThrows(TamperedOrWrongKeyException.class, () -> crypto.decrypt(tampered, key));
    }

    @Test
    void flippedTagBitIsDetected() {
        byte[] key = crypto.generateSymmetricKey();
        EncryptedPayload payload = crypto.encrypt("do not alter me", key);

        byte[] tag = Base64.getDecoder().decode(payload.tag());
        tag[tag.length - 1] ^= (byte) 0x80;
        EncryptedPayload tampered = new EncryptedPayload(
                payload.iv(), payload.ciphertext(), Base64.getEncoder().encodeToString(tag), payload.algorithm());

        assertThrows(TamperedOrWrongKeyException.class, () -> crypto.decrypt(tampered, key));
    }

    @Test
    void missingTagOrShortKeyIsACryptoFailure() {
        byte[] key = crypto.generateSymmetricKey();
        EncryptedPayload payload = crypto.encrypt("x", key);
        EncryptedPayload noTag = new EncryptedPayload(payload.iv(), payload.ciphertext(), null, payload.algorithm());

        assertThrows(CryptoFailureException.class, () -> crypto.decrypt(noTag, key));
        assertThrows(CryptoFailureException.class, () -> crypto.encrypt("x", new byte[16]));
    }

    // ─── KEY DERIVATION / PASSWORDS ──────────────────────────────────────────

    @Test
    void keyDerivationIsDeterministic() {
        byte[] salt = "0123456789abcdef".getBytes(StandardCharsets.UTF_8);

        byte[] first = crypto.deriveKeyFromPassword("correct horse", salt, 1_000);
        byte[] second = crypto.deriveKeyFromPassword("correct horse", salt, 1_000);
        byte[] otherSalt = crypto.deriveKeyFromPassword("correct horse", "fedcba9876543210".getBytes(StandardCharsets.UTF_8), 1_000);

        assertEquals(32, first.length);
        assertArrayEquals(first, second);
        assertFalse(java.util.Arrays.equals(first, otherSalt));
    }

    @Test
    void passwordHashVerifies() {
        PasswordHash hash = crypto.hashPassword("s3cret-pass");

        assertEquals(CryptoService.PBKDF2, hash.algorithm());
        assertEquals(1_000, hash.iterations());
        assertTrue(crypto.verifyPassword("s3cret-pass", hash));
        assertFalse(crypto.verifyPassword("s3cret-pasS", hash));
        assertFalse(crypto.verifyPassword(null, hash));
    }

    @Test
    void sameSaltGivesSameHash() {
        byte[] salt = crypto.randomBytes(16);

        assertEquals(crypto.hashPassword("pw", salt).hash(), crypto.hashPassword("pw", salt).hash());
        assertNotEquals(crypto.hashPassword("pw").salt(), crypto.hashPassword("pw").salt());
    }

    // ─── HMAC / IDS ──────────────────────────────────────────────────────────

    @Test
    void hmacVerifiesOnlyUntouchedData() {
        byte[] key = "csrf-signing-key".getBytes(StandardCharsets.UTF_8);
        String signature = crypto.hmac("session=42", key);

        assertTrue(crypto.verifyHmac("session=42", key, signature));
        assertFalse(crypto.verifyHmac("session=43", key, signature));
        assertFalse(crypto.verifyHmac("session=42", "other-key".getBytes(StandardCharsets.UTF_8), signature));
        assertFalse(crypto.verifyHmac("session=42", key, null));
    }

    @Test
    void secureIdsHavePrefixTimestampAndRandomPart() {
        String id = crypto.generateSecureId("share");
        String[] parts = id.split("_");

        assertEquals("share", parts[0]);
        assertEquals(Instant.parse("2026-03-01T10:00:00Z").toEpochMilli(), Long.parseLong(parts[1], 36));
        assertEquals(32, parts[2].length());

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            ids.add(crypto.generateSecureId("x"));
        }
        assertEquals(500, ids.size());
    }

    @Test
    void tokensAreHexOfRequestedLength() {
        String token = crypto.generateSecureToken(32);

        assertEquals(64, token.length());
        assertTrue(token.matches("[0-9a-f]+"));
        assertThrows(IllegalArgumentException.class, () -> crypto.generateSecureToken(0));
    }

    @Test
    void keyPairIsX25519() {
        KeyPairMaterial pair = crypto.generateKeyPair();

        assertEquals("X25519", pair.algorithm());
        assertEquals(32, Base64.getDecoder().decode(pair.publicKey()).length);
        assertEquals(32, Base64.getDecoder().decode(pair.privateKey()).length);
        assertTrue(pair.keyId().startsWith("key_"));
    }

    @Test
    void sha256HexMatchesKnownVector() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", crypto.sha256Hex("abc"));
    }
}
