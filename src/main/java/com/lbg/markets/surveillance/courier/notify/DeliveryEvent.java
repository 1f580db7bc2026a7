package com.lbg.markets.surveillance.courier.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lbg.markets.surveillance.courier.domain.FileRecord;

/**
 * Terminal outcome pushed to the aggregator.
 */
public record DeliveryEvent(
        @JsonProperty("type") String type,
        @JsonProperty("file") String file,
        @JsonProperty("file_id") long fileId,
        @JsonProperty("hash") String hash,
        @JsonProperty("file_size") long fileSize,
        @JsonProperty("processing_time") double processingTimeMs,
        @JsonProperty("upload_speed") double uploadBytesPerSec
) {
    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    public static DeliveryEvent success(String fileName, FileRecord record) {
        return new DeliveryEvent(SUCCESS, fileName, record.sequenceId(), record.hash(), record.originalSize(),
                record.processingTimeMs(), record.uploadBytesPerSec());
    }

    public static DeliveryEvent failure(String fileName, String hash, long fileSize, double processingTimeMs) {
        return new DeliveryEvent(FAILURE, fileName, -1, hash, fileSize, processingTimeMs, 0);
    }
}
