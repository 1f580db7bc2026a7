package com.lbg.markets.surveillance.courier.source;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Filename suffix allow-list. An empty list allows everything.
 */
public final class ExtensionFilter {

    private final Set<String> suffixes;

    public ExtensionFilter(Set<String> allowed) {
        this.suffixes = allowed == null ? Set.of() : allowed.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static ExtensionFilter allowAll() {
        return new ExtensionFilter(Set.of());
    }

    public boolean allows(String fileName) {
        if (suffixes.isEmpty()) {
            return true;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return suffixes.stream().anyMatch(lower::endsWith);
    }
}
