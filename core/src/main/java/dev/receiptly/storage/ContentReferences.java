package dev.receiptly.storage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Derives the content-addressed reference shared by conversation images and stored receipts:
 * the lowercase hex SHA-256 digest of the raw image bytes.
 */
public final class ContentReferences {

    public static final int REFERENCE_LENGTH = 64;

    private ContentReferences() {
        // Utility class
    }

    public static String fromBytes(byte[] content) {
        Objects.requireNonNull(content, "content");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new BlobStorageException("SHA-256 algorithm not available", ex);
        }
    }

    public static boolean isValid(String reference) {
        if (reference == null || reference.length() != REFERENCE_LENGTH) {
            return false;
        }
        for (int i = 0; i < reference.length(); i++) {
            char c = reference.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder(2 * bytes.length);
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
