package io.agentgw.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Salted SHA-256 digests for pairing codes and access tokens, plus the random material they are
 * minted from. Digest comparison is always {@link MessageDigest#isEqual}, never {@code equals}.
 */
public final class SecretDigests {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private SecretDigests() {
    }

    public static String newSalt() {
        byte[] salt = new byte[16];
        RANDOM.nextBytes(salt);
        return Base64.getEncoder().encodeToString(salt);
    }

    public static String digest(String salt, String secret) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(Base64.getDecoder().decode(salt));
            return HEX.formatHex(md.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Recomputes the digest of {@code candidate} under {@code salt} and compares it in constant time.
     * Malformed stored material never matches.
     */
    public static boolean matches(String salt, String storedHash, String candidate) {
        if (salt == null || storedHash == null || candidate == null) {
            return false;
        }
        try {
            byte[] expected = HEX.parseHex(storedHash);
            byte[] actual = HEX.parseHex(digest(salt, candidate));
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Constant-time comparison of two plaintext secrets, used for the static gateway token.
     */
    public static boolean constantTimeEquals(String expected, String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        try {
            // Hash first so the comparison length does not depend on the presented value.
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] left = md.digest(expected.getBytes(StandardCharsets.UTF_8));
            byte[] right = md.digest(presented.getBytes(StandardCharsets.UTF_8));
            return MessageDigest.isEqual(left, right);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String randomHex(int bytes) {
        byte[] raw = new byte[bytes];
        RANDOM.nextBytes(raw);
        return HEX.formatHex(raw);
    }

    public static String randomUrlSafe(int bytes) {
        byte[] raw = new byte[bytes];
        RANDOM.nextBytes(raw);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    }
}
