package com.lbg.markets.surveillance.courier.notify;

import com.lbg.markets.surveillance.courier.domain.FileRecord;

import java.util.Map;

/**
 * Best-effort outlet for pipeline outcomes. Implementations must not throw.
 */
public interface EventNotifier {

    void publish(DeliveryEvent event);

    /**
     * Push the whole ledger, done once at startup.
     */
    void publishHistory(Map<String, FileRecord> history);
}
