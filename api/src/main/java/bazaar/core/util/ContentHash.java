package bazaar.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short, stable digests of cache key material.
 */
public final class ContentHash {

    private static final int MAX_HEX_CHARS = 64;

    private ContentHash() {}

    /**
     * Return the first {@code hexChars} characters of the SHA-256 hex digest.
     *
     * @param input    the string to hash, UTF-8 encoded
     * @param hexChars number of hex characters to return (1 to 64)
     * @return truncated lower-case hex digest
     * @throws IllegalArgumentException if hexChars is out of range
     */
    public static String sha256Hex(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hex = HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
            return hex.substring(0, hexChars);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is a required JDK algorithm", e);
        }
    }
}
