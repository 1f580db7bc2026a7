package com.lbg.markets.surveillance.courier.domain;

import java.util.Locale;

public enum CompressionMode {
    DEFAULT,
    FAST,
    NONE;

    public static CompressionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown compression mode '" + value + "', expected default, fast or none", e);
        }
    }
}
