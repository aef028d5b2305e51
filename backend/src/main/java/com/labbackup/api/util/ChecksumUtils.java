package com.labbackup.api.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers shared by upload, restore and verification. Checksums are lower-case hex.
 */
public final class ChecksumUtils {

    private ChecksumUtils() {
    }

    public static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hex(MessageDigest digest) {
        return HexFormat.of().formatHex(digest.digest());
    }

    public static boolean matches(String expected, String actual) {
        return expected != null && expected.equalsIgnoreCase(actual);
    }
}
