package com.lbg.markets.surveillance.courier.sink;

import java.util.Locale;

/**
 * Our own membership in a destination chat.
 */
public enum MembershipStatus {
    CREATOR,
    ADMINISTRATOR,
    MEMBER,
    RESTRICTED,
    LEFT,
    REMOVED,
    UNKNOWN;

    public static MembershipStatus fromWire(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "creator" -> CREATOR;
            case "administrator" -> ADMINISTRATOR;
            case "member" -> MEMBER;
            case "restricted" -> RESTRICTED;
            case "left" -> LEFT;
            case "kicked" -> REMOVED;
            default -> UNKNOWN;
        };
    }

    /**
     * False when we can no longer post there, which rules out forwarding.
     */
    public boolean canReceive() {
        return this != REMOVED && this != LEFT;
    }
}
