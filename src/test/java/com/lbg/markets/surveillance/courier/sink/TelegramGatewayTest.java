package com.lbg.markets.surveillance.courier.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramGatewayTest {

    @TempDir
    Path dir;

    private MockWebServer server;
    private TelegramGateway gateway;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setup() throws IOException {
        server = new MockWebServer();
        server.start();
        gateway = new TelegramGateway(server.url("/").toString(), "123:abc", Duration.ofSeconds(5), mapper);
    }

    @AfterEach
    void teardown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Test
    void shouldUploadDocumentAsMultipart() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"message_id\":42}}"));
        Path file = Files.writeString(dir.resolve("report.csv"), "a,b,c");

        SendResult result = gateway.sendDocument(-100123, file, "File: report\\.csv");

        assertTrue(result.isSuccess());
        assertEquals(42, result.messageId());
        RecordedRequest request = server.takeRequest();
        assertEquals("/bot123:abc/sendDocument", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("-100123"));
        assertTrue(body.contains("File: report\\.csv"));
        assertTrue(body.contains("MarkdownV2"));
        assertTrue(body.contains("filename=\"report.csv\""));
        assertTrue(body.contains("a,b,c"));
    }

    @Test
    void shouldSendMessageAsJson() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"message_id\":7}}"));

        SendResult result = gateway.sendMessage(55, "hello");

        assertEquals(7, result.messageId());
        JsonNode sent = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals(55, sent.get("chat_id").asLong());
        assertEquals("hello", sent.get("text").asText());
        assertEquals("MarkdownV2", sent.get("parse_mode").asText());
    }

    @Test
    void shouldTurnTooManyRequestsIntoRetryAfter() {
        server.enqueue(json(429, "{\"ok\":false,\"error_code\":429,"
                + "\"description\":\"Too Many Requests: retry after 3\",\"parameters\":{\"retry_after\":3}}"));

        SendResult result = gateway.sendMessage(1, "x");

        assertEquals(SendResult.Status.RETRY_AFTER, result.status());
        assertEquals(Duration.ofSeconds(3), result.retryAfter());
    }

    @Test
    void shouldClassifyFailures() {
        server.enqueue(json(401, "{\"ok\":false,\"description\":\"Unauthorized\"}"));
        server.enqueue(json(400, "{\"ok\":false,\"description\":\"Bad Request: chat not found\"}"));
        server.enqueue(json(502, ""));
        server.enqueue(json(200, "not json"));

        assertEquals(SendResult.FailureKind.UNAUTHORIZED, gateway.sendMessage(1, "x").failureKind());
        SendResult rejected = gateway.sendMessage(1, "x");
        assertEquals(SendResult.FailureKind.REJECTED, rejected.failureKind());
        assertEquals("Bad Request: chat not found", rejected.detail());
        assertEquals(SendResult.FailureKind.SERVER, gateway.sendMessage(1, "x").failureKind());
        assertEquals(SendResult.FailureKind.MALFORMED_RESPONSE, gateway.sendMessage(1, "x").failureKind());
    }

    @Test
    void shouldReportNetworkFailure() throws IOException {
        MockWebServer gone = new MockWebServer();
        gone.start();
        String url = gone.url("/").toString();
        gone.shutdown();
        TelegramGateway unreachable = new TelegramGateway(url, "123:abc", Duration.ofSeconds(2), mapper);

        SendResult result = unreachable.sendMessage(1, "x");

        assertEquals(SendResult.Status.FAILURE, result.status());
        assertEquals(SendResult.FailureKind.NETWORK, result.failureKind());
    }

    @Test
    void shouldForwardAndDelete() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"message_id\":900}}"));
        server.enqueue(json(200, "{\"ok\":true,\"result\":true}"));

        assertEquals(900, gateway.forwardMessage(2, 1, 42).messageId());
        SendResult deleted = gateway.deleteMessage(1, 42);

        assertTrue(deleted.isSuccess());
        assertEquals(42, deleted.messageId());
        JsonNode forward = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals(2, forward.get("chat_id").asLong());
        assertEquals(1, forward.get("from_chat_id").asLong());
        assertEquals(42, forward.get("message_id").asLong());
        assertEquals("/bot123:abc/deleteMessage", server.takeRequest().getPath());
    }

    @Test
    void shouldReadOwnIdentity() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"id\":777,\"is_bot\":true}}"));

        assertEquals(777, gateway.identity().getAsLong());
        assertEquals("/bot123:abc/getMe", server.takeRequest().getPath());
    }

    @Test
    void shouldReportNoIdentityOnError() {
        server.enqueue(json(401, "{\"ok\":false,\"description\":\"Unauthorized\"}"));
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"is_bot\":true}}"));

        assertTrue(gateway.identity().isEmpty());
        assertTrue(gateway.identity().isEmpty());
    }

    @Test
    void shouldReadMembershipWithOneCallPerQuery() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"status\":\"kicked\"}}"));
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"status\":\"administrator\"}}"));

        assertEquals(MembershipStatus.REMOVED, gateway.membershipStatus(-5, 777));
        assertEquals(MembershipStatus.ADMINISTRATOR, gateway.membershipStatus(-6, 777));

        RecordedRequest first = server.takeRequest();
        assertEquals("/bot123:abc/getChatMember", first.getPath());
        JsonNode query = mapper.readTree(first.getBody().readUtf8());
        assertEquals(-5, query.get("chat_id").asLong());
        assertEquals(777, query.get("user_id").asLong());
        assertEquals("/bot123:abc/getChatMember", server.takeRequest().getPath());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void shouldReportUnknownMembershipOnError() {
        server.enqueue(json(400, "{\"ok\":false,\"description\":\"chat not found\"}"));

        assertEquals(MembershipStatus.UNKNOWN, gateway.membershipStatus(-5, 777));
        assertEquals(1, server.getRequestCount());
    }
}
