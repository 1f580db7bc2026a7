package com.lbg.markets.surveillance.courier.domain;

/**
 * How a source file is turned into a transportable artifact.
 * An encrypted container must be compressed and must carry a non-empty passphrase.
 */
public record ArchiveSpec(
        CompressionMode compression,
        boolean encryptionEnabled,
        String passphrase
) {
    public ArchiveSpec {
        if (compression == null) {
            throw new IllegalArgumentException("compression cannot be null");
        }
        if (encryptionEnabled && compression == CompressionMode.NONE) {
            throw new IllegalArgumentException(
                    "Encryption cannot be enabled when compression is set to 'none'");
        }
        if (encryptionEnabled && (passphrase == null || passphrase.isEmpty())) {
            throw new IllegalArgumentException("Encryption is enabled but no passphrase is configured");
        }
    }

    public static ArchiveSpec plain(CompressionMode compression) {
        return new ArchiveSpec(compression, false, null);
    }

    public static ArchiveSpec encrypted(CompressionMode compression, String passphrase) {
        return new ArchiveSpec(compression, true, passphrase);
    }

    public EncryptionAlgorithm algorithm() {
        return encryptionEnabled ? EncryptionAlgorithm.AES : EncryptionAlgorithm.NONE;
    }

    @Override
    public String toString() {
        // keep the passphrase out of logs
        return "ArchiveSpec[compression=" + compression + ", encryptionEnabled=" + encryptionEnabled + "]";
    }
}
