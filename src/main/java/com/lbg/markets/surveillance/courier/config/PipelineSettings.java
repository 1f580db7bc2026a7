package com.lbg.markets.surveillance.courier.config;

import com.lbg.markets.surveillance.courier.domain.ArchiveSpec;
import com.lbg.markets.surveillance.courier.domain.CompressionMode;
import com.lbg.markets.surveillance.courier.source.ExtensionFilter;
import io.quarkus.runtime.configuration.ConfigurationException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validated pipeline settings derived from {@link CourierConfig}.
 * Building one from an inconsistent configuration fails with a
 * {@link ConfigurationException} so the application never starts scanning.
 */
public record PipelineSettings(
        List<Path> roots,
        ExtensionFilter extensions,
        ArchiveSpec archiveSpec,
        long maxChunkBytes,
        Path scratchRoot,
        boolean sizeCacheEnabled,
        Duration scanInterval
) {
    public PipelineSettings {
        roots = roots != null ? List.copyOf(roots) : List.of();
        if (extensions == null) {
            extensions = ExtensionFilter.allowAll();
        }
        if (maxChunkBytes <= 0) {
            throw new IllegalArgumentException("maxChunkBytes must be positive");
        }
    }

    public static PipelineSettings from(CourierConfig config) {
        ArchiveSpec archiveSpec;
        try {
            archiveSpec = new ArchiveSpec(
                    CompressionMode.parse(config.archive().compression()),
                    config.archive().encryption().enabled(),
                    config.archive().encryption().passphrase().orElse(""));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid archive configuration: " + e.getMessage(),
                    Set.of("courier.archive.compression", "courier.archive.encryption.enabled",
                            "courier.archive.encryption.passphrase"));
        }
        if (config.chunk().maxBytes() <= 0) {
            throw new ConfigurationException("courier.chunk.max-bytes must be positive",
                    Set.of("courier.chunk.max-bytes"));
        }
        List<Path> roots = config.folders().orElse(List.of()).stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Paths::get)
                .collect(Collectors.toList());
        return new PipelineSettings(
                roots,
                new ExtensionFilter(config.allowedExtensions().orElse(Set.of())),
                archiveSpec,
                config.chunk().maxBytes(),
                config.archive().scratchDir().map(Paths::get).orElse(null),
                config.sizeCache().enabled(),
                config.scan().interval());
    }
}
