package com.lbg.markets.surveillance.courier.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lbg.markets.surveillance.courier.config.CourierConfig;
import com.lbg.markets.surveillance.courier.domain.FileRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Posts events to the aggregator without waiting for the answer.
 * Calls are bounded by the configured timeout; any failure is logged at WARN.
 */
@ApplicationScoped
public class HttpEventNotifier implements EventNotifier {

    private static final Logger LOG = Logger.getLogger(HttpEventNotifier.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final boolean enabled;
    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;

    @Inject
    public HttpEventNotifier(CourierConfig config, ObjectMapper mapper) {
        this(config.aggregator().enabled(), config.aggregator().url(), config.aggregator().timeout(), mapper);
    }

    public HttpEventNotifier(boolean enabled, String baseUrl, Duration timeout, ObjectMapper mapper) {
        this.enabled = enabled;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.mapper = mapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    @Override
    public void publish(DeliveryEvent event) {
        post("/event", event, "event " + event.type() + " for " + event.file());
    }

    @Override
    public void publishHistory(Map<String, FileRecord> history) {
        post("/file_history", history, "file history (" + history.size() + " entries)");
    }

    private void post(String path, Object payload, String what) {
        if (!enabled) {
            return;
        }
        Request request;
        try {
            request = new Request.Builder()
                    .url(baseUrl + path)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warnf("Unable to build aggregator request for %s: %s", what, e.getMessage());
            return;
        }
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                LOG.warnf("Unable to connect to aggregator (%s): %s", what, e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        ResponseBody body = response.body();
                        LOG.warnf("Aggregator rejected %s with %d: %s", what, response.code(),
                                body != null ? body.string() : "");
                    } else {
                        LOG.debugf("Aggregator accepted %s", what);
                    }
                } catch (IOException e) {
                    LOG.warnf("Could not read aggregator response for %s: %s", what, e.getMessage());
                }
            }
        });
    }
}
