package com.lbg.markets.surveillance.courier.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Protection applied to a delivered artifact, as recorded in the ledger.
 */
public enum EncryptionAlgorithm {
    NONE("None"),
    AES("AES");

    private final String label;

    EncryptionAlgorithm(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static EncryptionAlgorithm fromLabel(String label) {
        if (label == null) {
            return NONE;
        }
        for (EncryptionAlgorithm algorithm : values()) {
            if (algorithm.label.equalsIgnoreCase(label)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown encryption algorithm: " + label);
    }
}
