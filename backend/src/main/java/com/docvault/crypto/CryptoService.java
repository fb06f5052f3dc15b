package com.docvault.crypto;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.generators.X25519KeyPairGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.X25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.time.Clock;
import java.util.Base64;

/**
 * Cryptographic primitives for DocVault: AES-256-GCM authenticated encryption, PBKDF2-SHA256 key
 * derivation and password hashing, HMAC-SHA256, X25519 key pairs and random identifiers.
 *
 * <p>Stateless apart from the entropy source. Every method either returns a complete result or
 * throws a {@link CryptoFailureException}; there are no fallback values (no zero IVs, no empty
 * keys).
 */
public class CryptoService {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final String AES_GCM = "AES-256-GCM";
    public static final String PBKDF2 = "PBKDF2-SHA256";
    public static final int DEFAULT_ITERATIONS = 100_000;

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final String HMAC_ALGO = "HmacSHA256";
    private static final int KEY_SIZE = 32;   // 256-bit
    private static final int IV_SIZE = 12;    // 96-bit IV
    private static final int TAG_SIZE = 16;   // 128-bit authentication tag
    private static final int SALT_SIZE = 16;
    private static final int ID_RANDOM_BYTES = 16;

    private final SecureRandom secureRandom;
    private final int passwordIterations;
    private final Clock clock;

    public CryptoService(int passwordIterations, Clock clock) {
        if (passwordIterations < 1) {
            throw new IllegalArgumentException("PBKDF2 iterations must be positive");
        }
        this.passwordIterations = passwordIterations;
        this.clock = clock;
        try {
            this.secureRandom = new SecureRandom();
        } catch (RuntimeException e) {
            throw new CryptoFailureException("Secure random source unavailable", e);
        }
    }

    public int passwordIterations() {
        return passwordIterations;
    }

    public byte[] generateSymmetricKey() {
        return randomBytes(KEY_SIZE);
    }

    public KeyPairMaterial generateKeyPair() {
        X25519KeyPairGenerator generator = new X25519KeyPairGenerator();
        generator.init(new X25519KeyGenerationParameters(secureRandom));
        AsymmetricCipherKeyPair pair = generator.generateKeyPair();

        X25519PublicKeyParameters publicKey = (X25519PublicKeyParameters) pair.getPublic();
        X25519PrivateKeyParameters privateKey = (X25519PrivateKeyParameters) pair.getPrivate();
        return new KeyPairMaterial(
                generateSecureId("key"),
                Base64.getEncoder().encodeToString(publicKey.getEncoded()),
                Base64.getEncoder().encodeToString(privateKey.getEncoded()),
                "X25519",
                clock.instant());
    }

    /**
     * PBKDF2-HMAC-SHA256 producing a 256-bit key. Same inputs always give the same key.
     */
    public byte[] deriveKeyFromPassword(String password, byte[] salt, int iterations) {
        if (password == null || salt == null || salt.length == 0 || iterations < 1) {
            throw new CryptoFailureException("Password, salt and a positive iteration count are required");
        }
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(password.getBytes(StandardCharsets.UTF_8), salt, iterations);
        return ((KeyParameter) generator.generateDerivedParameters(KEY_SIZE * 8)).getKey();
    }

    public EncryptedPayload encrypt(byte[] plaintext, byte[] key) {
        requireKey(key);
        byte[] iv = randomBytes(IV_SIZE);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            // JCA appends the tag to the ciphertext; we persist them separately
            byte[] ciphertext = java.util.Arrays.copyOfRange(sealed, 0, sealed.length - TAG_SIZE);
            byte[] tag = java.util.Arrays.copyOfRange(sealed, sealed.length - TAG_SIZE, sealed.length);

            Base64.Encoder encoder = Base64.getEncoder();
            return new EncryptedPayload(
                    encoder.encodeToString(iv),
                    encoder.encodeToString(ciphertext),
                    encoder.encodeToString(tag),
                    AES_GCM);
        } catch (GeneralSecurityException e) {
            throw new CryptoFailureException("Encryption failed", e);
        }
    }

    public EncryptedPayload encrypt(String plaintext, byte[] key) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    public byte[] decrypt(EncryptedPayload payload, byte[] key) {
        requireKey(key);
        if (payload == null || !payload.isComplete()) {
            throw new CryptoFailureException("Encrypted payload is missing its IV, ciphertext or tag");
        }
        if (!AES_GCM.equals(payload.algorithm())) {
            throw new CryptoFailureException("Unsupported algorithm: " + payload.algorithm());
        }

        byte[] iv;
        byte[] ciphertext;
        byte[] tag;
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            iv = decoder.decode(payload.iv());
            ciphertext = decoder.decode(payload.ciphertext());
            tag = decoder.decode(payload.tag());
        } catch (IllegalArgumentException e) {
            throw new TamperedOrWrongKeyException("Encrypted payload is not valid Base64", e);
        }
        if (iv.length != IV_SIZE || tag.length != TAG_SIZE) {
            throw new TamperedOrWrongKeyException("Encrypted payload has a malformed IV or tag", null);
        }

        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE * 8, iv));
            return cipher.doFinal(Arrays.concatenate(ciphertext, tag));
        } catch (AEADBadTagException e) {
            throw new TamperedOrWrongKeyException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoFailureException("Decryption failed", e);
        }
    }

    public String decryptToString(EncryptedPayload payload, byte[] key) {
        return new String(decrypt(payload, key), StandardCharsets.UTF_8);
    }

    public PasswordHash hashPassword(String password) {
        return hashPassword(password, randomBytes(SALT_SIZE), passwordIterations);
    }

    public PasswordHash hashPassword(String password, byte[] salt) {
        return hashPassword(password, salt, passwordIterations);
    }

    private PasswordHash hashPassword(String password, byte[] salt, int iterations) {
        byte[] derived = deriveKeyFromPassword(password, salt, iterations);
        return new PasswordHash(
                Base64.getEncoder().encodeToString(derived),
                Base64.getEncoder().encodeToString(salt),
                PBKDF2,
                iterations);
    }

    /**
     * Recomputes the hash with the stored salt and iteration count and compares in constant time.
     */
    public boolean verifyPassword(String password, PasswordHash expected) {
        if (password == null || expected == null || expected.salt() == null || expected.hash() == null) {
            return false;
        }
        byte[] salt = Base64.getDecoder().decode(expected.salt());
        byte[] computed = deriveKeyFromPassword(password, salt, expected.iterations());
        return Arrays.constantTimeAreEqual(computed, Base64.getDecoder().decode(expected.hash()));
    }

    public String hmac(String data, byte[] key) {
        if (key == null || key.length == 0) {
            throw new CryptoFailureException("HMAC key must not be empty");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGO);
            mac.init(new SecretKeySpec(key, HMAC_ALGO));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new CryptoFailureException("HMAC computation failed", e);
        }
    }

    public boolean verifyHmac(String data, byte[] key, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = hmac(data, key).getBytes(StandardCharsets.US_ASCII);
        return Arrays.constantTimeAreEqual(expected, signature.getBytes(StandardCharsets.US_ASCII));
    }

    public String sha256Hex(String data) {
        SHA256Digest digest = new SHA256Digest();
        byte[] input = data.getBytes(StandardCharsets.UTF_8);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    /** Hex string of {@code lengthBytes} random bytes. */
    public String generateSecureToken(int lengthBytes) {
        if (lengthBytes < 1) {
            throw new IllegalArgumentException("Token length must be positive");
        }
        return Hex.toHexString(randomBytes(lengthBytes));
    }

    /** {@code prefix_<base36 millis>_<128 random bits as hex>}. */
    public String generateSecureId(String prefix) {
        String timestamp = Long.toString(clock.millis(), 36);
        return prefix + "_" + timestamp + "_" + generateSecureToken(ID_RANDOM_BYTES);
    }

    public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        try {
            secureRandom.nextBytes(bytes);
        } catch (RuntimeException e) {
            throw new CryptoFailureException("Secure random source unavailable", e);
        }
        return bytes;
    }

    private static void requireKey(byte[] key) {
        if (key == null || key.length != KEY_SIZE) {
            throw new CryptoFailureException("AES-256 requires a 32-byte key");
        }
    }
}
