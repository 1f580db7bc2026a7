package com.lbg.markets.surveillance.courier.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;

/**
 * Ledger entry for a monitored path. Written only once every part of the
 * path's artifact has been delivered.
 *
 * <p>{@code path} may be absent in persisted ledgers, where the map key is the
 * path; the store fills it in on load and the tracker refuses to commit without it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileRecord(
        @JsonProperty("path") String path,
        @JsonProperty("hash") String hash,
        @JsonProperty("last_sent") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant lastSentAt,
        @JsonProperty("send_success") boolean deliverySucceeded,
        @JsonProperty("encrypted") boolean encrypted,
        @JsonProperty("encryption_algorithm") EncryptionAlgorithm encryptionAlgorithm,
        @JsonProperty("file_id") long sequenceId,
        @JsonProperty("file_size") long originalSize,
        @JsonProperty("processed_size") long processedSize,
        @JsonProperty("processing_time") double processingTimeMs,
        @JsonProperty("upload_speed") double uploadBytesPerSec
) {
    public FileRecord {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash cannot be blank");
        }
        if (encryptionAlgorithm == null) {
            encryptionAlgorithm = encrypted ? EncryptionAlgorithm.AES : EncryptionAlgorithm.NONE;
        }
    }

    /**
     * Same record filed under another key; used when the persisted map key and the
     * embedded path disagree (older ledgers carry no embedded path).
     */
    public FileRecord withPath(String newPath) {
        return new FileRecord(newPath, hash, lastSentAt, deliverySucceeded, encrypted, encryptionAlgorithm,
                sequenceId, originalSize, processedSize, processingTimeMs, uploadBytesPerSec);
    }
}
