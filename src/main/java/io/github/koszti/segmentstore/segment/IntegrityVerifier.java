package io.github.koszti.segmentstore.segment;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Content digest used for every segment, on write and on read.
 */
public final class IntegrityVerifier {
    private IntegrityVerifier() {}

    /**
     * Lowercase hex SHA-256 of {@code data}.
     */
    public static String sha256Hex(byte[] data) {
        return DigestUtils.sha256Hex(data);
    }

    /**
     * Recomputes the digest of {@code data} and compares it with {@code expectedHash} for exact equality.
     */
    public static boolean verify(byte[] data, String expectedHash) {
        if (data == null || expectedHash == null) {
            return false;
        }
        return sha256Hex(data).equals(expectedHash);
    }
}
