package com.lbg.markets.surveillance.courier.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Typed view over the {@code courier.*} keys in application.properties.
 */
@ConfigMapping(prefix = "courier")
public interface CourierConfig {

    /**
     * Monitored roots. Missing roots are logged and skipped at scan time.
     */
    Optional<List<String>> folders();

    /**
     * Case-insensitive filename suffixes; unset means every file qualifies.
     */
    @WithName("allowed-extensions")
    Optional<Set<String>> allowedExtensions();

    Scan scan();

    @WithName("size-cache")
    SizeCacheConfig sizeCache();

    Archive archive();

    Chunk chunk();

    State state();

    Gateway gateway();

    Transport transport();

    Aggregator aggregator();

    Admin admin();

    interface Scan {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("60s")
        Duration interval();

        @WithName("shutdown-grace")
        @WithDefault("30s")
        Duration shutdownGrace();
    }

    interface SizeCacheConfig {
        @WithDefault("true")
        boolean enabled();
    }

    interface Archive {
        @WithDefault("default")
        String compression();

        Encryption encryption();

        @WithName("scratch-dir")
        Optional<String> scratchDir();

        interface Encryption {
            @WithDefault("false")
            boolean enabled();

            Optional<String> passphrase();
        }
    }

    interface Chunk {
        // 45 MiB keeps every part under the remote payload ceiling
        @WithName("max-bytes")
        @WithDefault("47185920")
        long maxBytes();
    }

    interface State {
        @WithName("history-path")
        @WithDefault("data/bot_file_history.json")
        String historyPath();

        @WithName("size-cache-path")
        @WithDefault("data/file_size_cache.json")
        String sizeCachePath();
    }

    interface Gateway {
        @WithName("base-url")
        @WithDefault("https://api.telegram.org")
        String baseUrl();

        Optional<String> token();

        @WithName("chat-id")
        Optional<Long> chatId();

        @WithName("forward-enabled")
        @WithDefault("false")
        boolean forwardEnabled();

        @WithName("forward-chat-id")
        Optional<Long> forwardChatId();

        @WithName("local-outbox")
        @WithDefault("target/outbox")
        String localOutbox();

        @WithDefault("120s")
        Duration timeout();
    }

    interface Transport {
        @WithName("max-attempts")
        @WithDefault("3")
        int maxAttempts();

        @WithName("retry-delay")
        @WithDefault("5s")
        Duration retryDelay();

        Pool control();

        Pool media();

        interface Pool {
            int permits();

            Duration window();
        }
    }

    interface Aggregator {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("http://localhost:5000")
        String url();

        @WithDefault("5s")
        Duration timeout();
    }

    interface Admin {
        @WithName("log-files")
        @WithDefault("logs/courier.log")
        List<String> logFiles();
    }
}
