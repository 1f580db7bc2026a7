package com.lbg.markets.surveillance.courier.tracker;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message id of the error notice currently posted for a path. At most one
 * notice exists per path; it is removed when the path is next delivered.
 */
@ApplicationScoped
public class PendingErrors {

    private final Map<String, Long> noticeByPath = new ConcurrentHashMap<>();

    public Optional<Long> find(String path) {
        return Optional.ofNullable(noticeByPath.get(path));
    }

    public boolean has(String path) {
        return noticeByPath.containsKey(path);
    }

    public void remember(String path, long messageId) {
        noticeByPath.put(path, messageId);
    }

    public Optional<Long> remove(String path) {
        return Optional.ofNullable(noticeByPath.remove(path));
    }

    public int size() {
        return noticeByPath.size();
    }
}
