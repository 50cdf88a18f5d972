package net.ogimage.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing helpers used for deterministic cache keys.
 */
public final class HashUtils {

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes SHA-256 hash of string data using UTF-8 encoding.
     *
     * @param data String to hash
     * @return SHA-256 hash as byte array
     * @throws NoSuchAlgorithmException If SHA-256 algorithm is not available
     */
    public static byte[] computeSha256(String data) throws NoSuchAlgorithmException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return digest.digest(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Computes SHA-256 hash of string and returns as hexadecimal string.
     *
     * @param data String to hash
     * @return SHA-256 hash as lowercase hex string (64 characters)
     * @throws NoSuchAlgorithmException If SHA-256 algorithm is not available
     *
     * @example
     * <pre>{@code
     * String hex = HashUtils.sha256Hex("https://example.com|1200x630");
     * }</pre>
     */
    public static String sha256Hex(String data) throws NoSuchAlgorithmException {
        return bytesToHex(computeSha256(data));
    }

    /**
     * Converts byte array to lowercase hexadecimal string.
     */
    public static String bytesToHex(byte[] bytes) {
        char[] hexChars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int value = bytes[i] & 0xFF;
            hexChars[i * 2] = HEX_DIGITS[value >>> 4];
            hexChars[i * 2 + 1] = HEX_DIGITS[value & 0x0F];
        }
        return new String(hexChars);
    }
}
