package com.lbg.markets.surveillance.courier.sink;

import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Remote messaging endpoint. Captions and texts arrive already formatted for
 * the endpoint's markup dialect.
 */
public interface ChatGateway {

    SendResult sendDocument(long chatId, Path document, String caption);

    SendResult sendMessage(long chatId, String text);

    SendResult forwardMessage(long toChatId, long fromChatId, long messageId);

    SendResult deleteMessage(long chatId, long messageId);

    /**
     * Our own user id on the endpoint, empty when it cannot be read.
     */
    OptionalLong identity();

    MembershipStatus membershipStatus(long chatId, long userId);
}
