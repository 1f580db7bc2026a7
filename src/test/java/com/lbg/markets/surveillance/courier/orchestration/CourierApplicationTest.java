package com.lbg.markets.surveillance.courier.orchestration;

import com.lbg.markets.surveillance.courier.admin.AdminService;
import com.lbg.markets.surveillance.courier.config.PipelineSettings;
import com.lbg.markets.surveillance.courier.domain.TransferResult;
import com.lbg.markets.surveillance.courier.sink.LocalFsGateway;
import com.lbg.markets.surveillance.courier.util.TestFiles;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
class CourierApplicationTest {

    @Inject
    ScanScheduler scheduler;

    @Inject
    AdminService admin;

    @Inject
    LocalFsGateway gateway;

    @Inject
    PipelineSettings settings;

    private Path watched;

    @BeforeEach
    void setup() throws IOException {
        watched = settings.roots().get(0);
        TestFiles.deleteRecursively(watched);
        Files.createDirectories(watched);
        admin.clearAllState();
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(watched);
    }

    private List<String> outbox() throws IOException {
        Path chat = gateway.chatDirectory(1);
        if (!Files.isDirectory(chat)) {
            return List.of();
        }
        try (var files = Files.list(chat)) {
            return files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        }
    }

    @Test
    void shouldNotScanOnItsOwnInTests() {
        assertFalse(scheduler.isRunning());
    }

    @Test
    void shouldDeliverToOutboxAndSkipOnSecondCycle() throws Exception {
        Files.writeString(watched.resolve("hello.txt"), "Hello, world!");

        List<TransferResult> first = scheduler.runOnce();

        assertEquals(1, first.size());
        assertEquals(TransferResult.Status.DELIVERED, first.get(0).status());
        assertEquals(1, first.get(0).sequenceId());
        assertTrue(outbox().stream().anyMatch(name -> name.endsWith("-hello.txt.zip")));

        List<TransferResult> second = scheduler.runOnce();

        assertEquals(TransferResult.Status.SKIPPED, second.get(0).status());
        assertEquals(1, admin.history().size());
    }

    @Test
    void shouldSplitArtifactsAboveChunkSize() throws Exception {
        Files.write(watched.resolve("noise.bin"), TestFiles.randomBytes(4_000, 99));

        List<TransferResult> results = scheduler.runOnce();

        TransferResult result = results.get(0);
        assertEquals(TransferResult.Status.DELIVERED, result.status());
        assertTrue(result.partsSent() >= 4);
        assertTrue(outbox().stream().anyMatch(name -> name.endsWith("-noise.bin.zip.001")));
        assertEquals(result.sequenceId(), admin.findBySequenceId(result.sequenceId()).orElseThrow().sequenceId());
    }

    @Test
    void shouldForgetHistoryAfterReset() throws Exception {
        Files.writeString(watched.resolve("again.txt"), "send me twice");
        scheduler.runOnce();

        admin.clearAllState();
        List<TransferResult> results = scheduler.runOnce();

        assertEquals(TransferResult.Status.DELIVERED, results.get(0).status());
        assertEquals(1, results.get(0).sequenceId());
    }
}
