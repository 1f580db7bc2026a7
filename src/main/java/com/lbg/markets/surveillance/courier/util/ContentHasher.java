package com.lbg.markets.surveillance.courier.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprints for monitored files.
 * Reads in fixed-size blocks so memory use does not depend on file size.
 */
public final class ContentHasher {

    private static final int BLOCK_SIZE = 8192;

    private ContentHasher() {
        // Utility class
    }

    /**
     * SHA-256 of the file's bytes, lowercase hex.
     *
     * @throws IOException if the file cannot be read, including when it disappears mid-read
     */
    public static String hash(Path file) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BLOCK_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
