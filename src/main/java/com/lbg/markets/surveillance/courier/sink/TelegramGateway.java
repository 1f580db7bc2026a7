package com.lbg.markets.surveillance.courier.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lbg.markets.surveillance.courier.config.CourierConfig;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * Bot API client. Every call returns a {@link SendResult}; HTTP 429 with a
 * {@code retry_after} parameter becomes {@link SendResult.Status#RETRY_AFTER}.
 */
@ApplicationScoped
@IfBuildProfile("prod")
public class TelegramGateway implements ChatGateway {

    private static final Logger LOG = Logger.getLogger(TelegramGateway.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final String PARSE_MODE = "MarkdownV2";
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;

    @Inject
    public TelegramGateway(CourierConfig config, ObjectMapper mapper) {
        this(config.gateway().baseUrl(),
                config.gateway().token().orElseThrow(
                        () -> new IllegalStateException("courier.gateway.token is required")),
                config.gateway().timeout(),
                mapper);
    }

    public TelegramGateway(String baseUrl, String token, Duration timeout, ObjectMapper mapper) {
        this.endpoint = stripTrailingSlash(baseUrl) + "/bot" + token + "/";
        this.mapper = mapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    @Override
    public SendResult sendDocument(long chatId, Path document, String caption) {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("chat_id", Long.toString(chatId))
                .addFormDataPart("caption", caption)
                .addFormDataPart("parse_mode", PARSE_MODE)
                .addFormDataPart("document", document.getFileName().toString(),
                        RequestBody.create(document.toFile(), OCTET_STREAM))
                .build();
        return call("sendDocument", body);
    }

    @Override
    public SendResult sendMessage(long chatId, String text) {
        ObjectNode payload = mapper.createObjectNode()
                .put("chat_id", chatId)
                .put("text", text)
                .put("parse_mode", PARSE_MODE);
        return call("sendMessage", json(payload));
    }

    @Override
    public SendResult forwardMessage(long toChatId, long fromChatId, long messageId) {
        ObjectNode payload = mapper.createObjectNode()
                .put("chat_id", toChatId)
                .put("from_chat_id", fromChatId)
                .put("message_id", messageId);
        return call("forwardMessage", json(payload));
    }

    @Override
    public SendResult deleteMessage(long chatId, long messageId) {
        ObjectNode payload = mapper.createObjectNode()
                .put("chat_id", chatId)
                .put("message_id", messageId);
        SendResult result = call("deleteMessage", json(payload));
        return result.isSuccess() ? SendResult.success(messageId) : result;
    }

    @Override
    public OptionalLong identity() {
        try {
            JsonNode me = fetch("getMe", json(mapper.createObjectNode()));
            if (!me.path("id").canConvertToLong()) {
                LOG.warn("getMe returned no user id");
                return OptionalLong.empty();
            }
            return OptionalLong.of(me.path("id").asLong());
        } catch (GatewayCallException e) {
            LOG.warnf("Could not read own identity: %s", e.getMessage());
            return OptionalLong.empty();
        }
    }

    @Override
    public MembershipStatus membershipStatus(long chatId, long userId) {
        try {
            ObjectNode payload = mapper.createObjectNode()
                    .put("chat_id", chatId)
                    .put("user_id", userId);
            JsonNode result = fetch("getChatMember", json(payload));
            return MembershipStatus.fromWire(result.path("status").asText(null));
        } catch (GatewayCallException e) {
            LOG.warnf("Could not read membership in chat %d: %s", chatId, e.getMessage());
            return MembershipStatus.UNKNOWN;
        }
    }

    private SendResult call(String method, RequestBody body) {
        Request request = new Request.Builder().url(endpoint + method).post(body).build();
        try (Response response = httpClient.newCall(request).execute()) {
            JsonNode json = parse(response.body());
            if (response.isSuccessful() && json.path("ok").asBoolean(false)) {
                return SendResult.success(json.path("result").path("message_id").asLong(-1));
            }
            return classify(method, response.code(), json);
        } catch (JsonProcessingException e) {
            LOG.errorf("Malformed response from %s: %s", method, e.getOriginalMessage());
            return SendResult.failure(SendResult.FailureKind.MALFORMED_RESPONSE, e.getOriginalMessage());
        } catch (IOException e) {
            LOG.errorf("Call to %s failed: %s", method, e.getMessage());
            return SendResult.failure(SendResult.FailureKind.NETWORK, e.getMessage());
        }
    }

    private JsonNode fetch(String method, RequestBody body) throws GatewayCallException {
        Request request = new Request.Builder().url(endpoint + method).post(body).build();
        try (Response response = httpClient.newCall(request).execute()) {
            JsonNode json = parse(response.body());
            if (!response.isSuccessful() || !json.path("ok").asBoolean(false)) {
                throw new GatewayCallException(method + " returned " + response.code() + ": "
                        + json.path("description").asText(""));
            }
            return json.path("result");
        } catch (IOException e) {
            throw new GatewayCallException(method + " failed: " + e.getMessage());
        }
    }

    private SendResult classify(String method, int code, JsonNode json) {
        String description = json.path("description").asText("HTTP " + code);
        if (code == 429) {
            long seconds = json.path("parameters").path("retry_after").asLong(0);
            Duration wait = seconds > 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
            LOG.warnf("%s rate limited, retry after %s", method, wait);
            return SendResult.retryAfter(wait);
        }
        LOG.errorf("%s rejected with %d: %s", method, code, description);
        if (code == 401 || code == 403) {
            return SendResult.failure(SendResult.FailureKind.UNAUTHORIZED, description);
        }
        if (code >= 500) {
            return SendResult.failure(SendResult.FailureKind.SERVER, description);
        }
        return SendResult.failure(SendResult.FailureKind.REJECTED, description);
    }

    private JsonNode parse(ResponseBody body) throws IOException {
        String payload = body != null ? body.string() : "";
        if (payload.isBlank()) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(payload);
    }

    private RequestBody json(ObjectNode payload) {
        return RequestBody.create(payload.toString(), JSON);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static final class GatewayCallException extends Exception {
        GatewayCallException(String message) {
            super(message);
        }
    }
}
