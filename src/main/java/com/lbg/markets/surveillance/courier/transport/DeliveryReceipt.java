package com.lbg.markets.surveillance.courier.transport;

/**
 * Final result of delivering one unit after retries.
 */
public record DeliveryReceipt(boolean delivered, long messageId, int failedAttempts, String error) {

    public static DeliveryReceipt delivered(long messageId, int failedAttempts) {
        return new DeliveryReceipt(true, messageId, failedAttempts, null);
    }

    public static DeliveryReceipt failed(int failedAttempts, String error) {
        return new DeliveryReceipt(false, -1, failedAttempts, error);
    }
}
