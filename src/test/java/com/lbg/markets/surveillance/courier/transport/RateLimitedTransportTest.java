package com.lbg.markets.surveillance.courier.transport;

import com.lbg.markets.surveillance.courier.sink.MembershipStatus;
import com.lbg.markets.surveillance.courier.sink.ScriptedGateway;
import com.lbg.markets.surveillance.courier.sink.SendResult;
import com.lbg.markets.surveillance.courier.tracker.PendingErrors;
import com.lbg.markets.surveillance.courier.util.FakeTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitedTransportTest {

    private static final long PRIMARY = 1001;
    private static final long SECONDARY = 2002;

    @TempDir
    Path dir;

    private FakeTime time;
    private ScriptedGateway gateway;
    private PendingErrors pendingErrors;
    private Path document;

    @BeforeEach
    void setup() throws IOException {
        time = new FakeTime();
        gateway = new ScriptedGateway();
        pendingErrors = new PendingErrors();
        document = Files.writeString(dir.resolve("report.csv"), "a,b,c");
    }

    private RateLimitedTransport transport(boolean forward, int maxAttempts) {
        RateLimitedTransport.Settings settings = new RateLimitedTransport.Settings(
                PRIMARY, forward, forward ? SECONDARY : 0, maxAttempts, Duration.ofSeconds(5));
        return new RateLimitedTransport(gateway, pendingErrors, settings,
                new QuotaPool("control", 20, Duration.ofSeconds(1), time, time),
                new QuotaPool("media", 20, Duration.ofSeconds(60), time, time),
                time);
    }

    private DeliveryUnit unit() {
        return new DeliveryUnit("/watched/report.csv", document, "caption", "report.csv");
    }

    @Test
    void shouldDeliverOnFirstAttempt() throws InterruptedException {
        DeliveryReceipt receipt = transport(false, 3).deliverDocument(unit());

        assertTrue(receipt.delivered());
        assertEquals(0, receipt.failedAttempts());
        assertEquals(1, gateway.sent("sendDocument").size());
        assertEquals(PRIMARY, gateway.sent("sendDocument").get(0).chatId());
        assertEquals(Duration.ZERO, time.totalSlept());
    }

    @Test
    void shouldHonourRetryAfterWithoutConsumingAttempts() throws InterruptedException {
        gateway.thenDocument(SendResult.retryAfter(Duration.ofSeconds(3)))
                .thenDocument(SendResult.retryAfter(Duration.ofSeconds(3)))
                .thenDocument(SendResult.retryAfter(Duration.ofSeconds(3)));

        DeliveryReceipt receipt = transport(false, 1).deliverDocument(unit());

        assertTrue(receipt.delivered());
        assertEquals(0, receipt.failedAttempts());
        assertEquals(4, gateway.sent("sendDocument").size());
        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(3), Duration.ofSeconds(3)), time.sleeps());
    }

    @Test
    void shouldWaitRetryDelayBetweenFailedAttempts() throws InterruptedException {
        gateway.thenDocument(SendResult.failure(SendResult.FailureKind.NETWORK, "timeout"));

        DeliveryReceipt receipt = transport(false, 3).deliverDocument(unit());

        assertTrue(receipt.delivered());
        assertEquals(1, receipt.failedAttempts());
        assertEquals(List.of(Duration.ofSeconds(5)), time.sleeps());
    }

    @Test
    void shouldPostOneErrorNoticeWhenAttemptsRunOut() throws InterruptedException {
        gateway.failDocumentsWhere(name -> true);
        RateLimitedTransport transport = transport(false, 3);

        DeliveryReceipt first = transport.deliverDocument(unit());
        DeliveryReceipt second = transport.deliverDocument(unit());

        assertFalse(first.delivered());
        assertEquals(3, first.failedAttempts());
        assertFalse(second.delivered());
        assertEquals(6, gateway.sent("sendDocument").size());
        // no delay after the last attempt
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(5),
                Duration.ofSeconds(5), Duration.ofSeconds(5)), time.sleeps());

        List<ScriptedGateway.Sent> notices = gateway.sent("sendMessage");
        assertEquals(1, notices.size());
        assertEquals("Error sending file: report\\.csv\\. Check logs\\.", notices.get(0).text());
        assertEquals(notices.get(0).messageId(), pendingErrors.find("/watched/report.csv").orElseThrow());
    }

    @Test
    void shouldRetractErrorNoticeOnce() throws InterruptedException {
        pendingErrors.remember("/watched/report.csv", 77L);
        RateLimitedTransport transport = transport(false, 3);

        transport.retractErrorNotice("/watched/report.csv");
        transport.retractErrorNotice("/watched/report.csv");

        List<ScriptedGateway.Sent> deletes = gateway.sent("deleteMessage");
        assertEquals(1, deletes.size());
        assertEquals(77L, deletes.get(0).messageId());
        assertEquals(PRIMARY, deletes.get(0).chatId());
        assertFalse(pendingErrors.has("/watched/report.csv"));
    }

    @Test
    void shouldWaitOutRateLimitWhenRetractingErrorNotice() throws InterruptedException {
        pendingErrors.remember("/watched/report.csv", 77L);
        gateway.thenDelete(SendResult.retryAfter(Duration.ofSeconds(3)));

        transport(false, 3).retractErrorNotice("/watched/report.csv");

        assertEquals(2, gateway.sent("deleteMessage").size());
        assertEquals(List.of(Duration.ofSeconds(3)), time.sleeps());
        assertFalse(pendingErrors.has("/watched/report.csv"));
    }

    @Test
    void shouldKeepErrorNoticeUntilDeletionSucceeds() throws InterruptedException {
        pendingErrors.remember("/watched/report.csv", 77L);
        gateway.thenDelete(SendResult.failure(SendResult.FailureKind.NETWORK, "timeout"))
                .thenDelete(SendResult.failure(SendResult.FailureKind.NETWORK, "timeout"));
        RateLimitedTransport transport = transport(false, 2);

        transport.retractErrorNotice("/watched/report.csv");

        assertEquals(2, gateway.sent("deleteMessage").size());
        assertEquals(77L, pendingErrors.find("/watched/report.csv").orElseThrow());

        transport.retractErrorNotice("/watched/report.csv");

        assertEquals(3, gateway.sent("deleteMessage").size());
        assertFalse(pendingErrors.has("/watched/report.csv"));
    }

    @Test
    void shouldForgetErrorNoticeTheEndpointNoLongerHas() throws InterruptedException {
        pendingErrors.remember("/watched/report.csv", 77L);
        gateway.thenDelete(SendResult.failure(SendResult.FailureKind.REJECTED, "message to delete not found"));

        transport(false, 1).retractErrorNotice("/watched/report.csv");

        assertEquals(1, gateway.sent("deleteMessage").size());
        assertFalse(pendingErrors.has("/watched/report.csv"));
    }

    @Test
    void shouldForwardDeliveredDocumentToSecondaryChat() throws InterruptedException {
        DeliveryReceipt receipt = transport(true, 3).deliverDocument(unit());

        List<ScriptedGateway.Sent> forwards = gateway.sent("forwardMessage");
        assertEquals(1, forwards.size());
        assertEquals(SECONDARY, forwards.get(0).chatId());
        assertEquals(receipt.messageId(), forwards.get(0).messageId());
        assertEquals(1, gateway.sent("identity").size());
        List<ScriptedGateway.Sent> membership = gateway.sent("membershipStatus");
        assertEquals(1, membership.size());
        assertEquals(SECONDARY, membership.get(0).chatId());
        assertEquals("7", membership.get(0).text());
    }

    @Test
    void shouldTakeControlPermitForEachForwardingCall() throws InterruptedException {
        RateLimitedTransport.Settings settings = new RateLimitedTransport.Settings(
                PRIMARY, true, SECONDARY, 3, Duration.ofSeconds(5));
        RateLimitedTransport transport = new RateLimitedTransport(gateway, pendingErrors, settings,
                new QuotaPool("control", 1, Duration.ofSeconds(1), time, time),
                new QuotaPool("media", 20, Duration.ofSeconds(60), time, time),
                time);

        transport.deliverDocument(unit());

        // identity, membership and forward each wait for their own permit
        assertEquals(Duration.ofSeconds(2), time.totalSlept());

        transport.deliverDocument(unit());

        assertEquals(1, gateway.sent("identity").size());
        assertEquals(2, gateway.sent("membershipStatus").size());
        assertEquals(2, gateway.sent("forwardMessage").size());
        assertEquals(Duration.ofSeconds(4), time.totalSlept());
    }

    @Test
    void shouldForwardWithoutMembershipCheckWhenIdentityUnknown() throws InterruptedException {
        gateway.identity(OptionalLong.empty());
        RateLimitedTransport transport = transport(true, 3);

        transport.deliverDocument(unit());
        transport.deliverDocument(unit());

        assertEquals(2, gateway.sent("identity").size());
        assertTrue(gateway.sent("membershipStatus").isEmpty());
        assertEquals(2, gateway.sent("forwardMessage").size());
    }

    @Test
    void shouldSkipForwardWhenRemovedFromSecondaryChat() throws InterruptedException {
        gateway.membership(MembershipStatus.REMOVED);

        DeliveryReceipt receipt = transport(true, 3).deliverDocument(unit());

        assertTrue(receipt.delivered());
        assertTrue(gateway.sent("forwardMessage").isEmpty());
    }

    @Test
    void shouldNotFailDeliveryWhenForwardFails() throws InterruptedException {
        gateway.failForwards(true);

        DeliveryReceipt receipt = transport(true, 3).deliverDocument(unit());

        assertTrue(receipt.delivered());
        assertEquals(1, gateway.sent("forwardMessage").size());
        assertTrue(pendingErrors.find("/watched/report.csv").isEmpty());
    }

    @Test
    void shouldSendTextToBothChatsWhenForwarding() throws InterruptedException {
        DeliveryReceipt receipt = transport(true, 3).deliverText("```\ncat a.* > a\n```");

        assertTrue(receipt.delivered());
        List<ScriptedGateway.Sent> messages = gateway.sent("sendMessage");
        assertEquals(2, messages.size());
        assertEquals(PRIMARY, messages.get(0).chatId());
        assertEquals(SECONDARY, messages.get(1).chatId());
    }

    @Test
    void shouldDrawDocumentsFromMediaPool() throws InterruptedException {
        RateLimitedTransport.Settings settings = new RateLimitedTransport.Settings(
                PRIMARY, false, 0, 3, Duration.ofSeconds(5));
        RateLimitedTransport transport = new RateLimitedTransport(gateway, pendingErrors, settings,
                new QuotaPool("control", 20, Duration.ofSeconds(1), time, time),
                new QuotaPool("media", 2, Duration.ofSeconds(60), time, time),
                time);

        transport.deliverDocument(unit());
        transport.deliverDocument(unit());
        transport.deliverDocument(unit());

        assertEquals(Duration.ofSeconds(60), time.totalSlept());
    }

    @Test
    void shouldRejectForwardingWithoutTarget() {
        assertThrows(IllegalArgumentException.class,
                () -> new RateLimitedTransport.Settings(PRIMARY, true, 0, 3, Duration.ofSeconds(5)));
    }
}
