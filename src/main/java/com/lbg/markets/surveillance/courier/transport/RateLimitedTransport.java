package com.lbg.markets.surveillance.courier.transport;

import com.lbg.markets.surveillance.courier.config.CourierConfig;
import com.lbg.markets.surveillance.courier.sink.ChatGateway;
import com.lbg.markets.surveillance.courier.sink.MembershipStatus;
import com.lbg.markets.surveillance.courier.sink.SendResult;
import com.lbg.markets.surveillance.courier.tracker.PendingErrors;
import com.lbg.markets.surveillance.courier.util.Sleeper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Delivers units to the remote endpoint one at a time.
 *
 * <p>Documents draw from the media pool, everything else from the control pool;
 * a permit is taken before every outbound call. A provider "retry after" is
 * waited out without counting as an attempt. Other failures wait
 * {@code retryDelay} and count. When a document runs out of attempts an error
 * notice is posted once for its path and remembered so the next success can
 * delete it.
 *
 * <p>With forwarding enabled, each delivered document is forwarded to the
 * secondary chat after a membership check. Our own identity is read once and
 * cached; each identity, membership and forward call takes its own control
 * permit. Secondary failures are logged and otherwise ignored.
 */
@ApplicationScoped
public class RateLimitedTransport {

    private static final Logger LOG = Logger.getLogger(RateLimitedTransport.class);

    public record Settings(
            long primaryChatId,
            boolean forwardEnabled,
            long forwardChatId,
            int maxAttempts,
            Duration retryDelay
    ) {
        public Settings {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (forwardEnabled && forwardChatId == 0) {
                throw new IllegalArgumentException("forwarding is enabled but no forward chat is configured");
            }
        }
    }

    private final ChatGateway gateway;
    private final PendingErrors pendingErrors;
    private final Settings settings;
    private final QuotaPool control;
    private final QuotaPool media;
    private final Sleeper sleeper;
    private volatile Long selfId;

    @Inject
    public RateLimitedTransport(ChatGateway gateway, PendingErrors pendingErrors, CourierConfig config) {
        this(gateway, pendingErrors, settingsFrom(config),
                new QuotaPool("control", config.transport().control().permits(),
                        config.transport().control().window(), Clock.systemUTC(), Sleeper.SYSTEM),
                new QuotaPool("media", config.transport().media().permits(),
                        config.transport().media().window(), Clock.systemUTC(), Sleeper.SYSTEM),
                Sleeper.SYSTEM);
    }

    public RateLimitedTransport(ChatGateway gateway, PendingErrors pendingErrors, Settings settings,
                                QuotaPool control, QuotaPool media, Sleeper sleeper) {
        this.gateway = gateway;
        this.pendingErrors = pendingErrors;
        this.settings = settings;
        this.control = control;
        this.media = media;
        this.sleeper = sleeper;
    }

    private static Settings settingsFrom(CourierConfig config) {
        CourierConfig.Gateway gateway = config.gateway();
        return new Settings(
                gateway.chatId().orElseThrow(() -> new IllegalStateException("courier.gateway.chat-id is required")),
                gateway.forwardEnabled(),
                gateway.forwardChatId().orElse(0L),
                config.transport().maxAttempts(),
                config.transport().retryDelay());
    }

    /**
     * Upload one document to the primary chat, retrying as configured.
     */
    public DeliveryReceipt deliverDocument(DeliveryUnit unit) throws InterruptedException {
        Attempted attempted = withRetries(media, "document " + unit.label(),
                () -> gateway.sendDocument(settings.primaryChatId(), unit.file(), unit.caption()));
        SendResult result = attempted.result();
        if (!result.isSuccess()) {
            LOG.errorf("Error sending file %s after %d attempts: %s",
                    unit.file(), attempted.failures(), result.detail());
            postErrorNotice(unit);
            return DeliveryReceipt.failed(attempted.failures(), result.detail());
        }
        LOG.infof("File sent successfully: %s", unit.file());
        forward(result.messageId());
        return DeliveryReceipt.delivered(result.messageId(), attempted.failures());
    }

    /**
     * Send a pre-formatted text to the primary chat and, with forwarding
     * enabled, as a separate message to the secondary chat.
     */
    public DeliveryReceipt deliverText(String text) throws InterruptedException {
        Attempted attempted = withRetries(control, "message",
                () -> gateway.sendMessage(settings.primaryChatId(), text));
        if (!attempted.result().isSuccess()) {
            LOG.errorf("Error sending message: %s", attempted.result().detail());
            return DeliveryReceipt.failed(attempted.failures(), attempted.result().detail());
        }
        if (settings.forwardEnabled()) {
            Attempted secondary = withRetries(control, "message to forward chat",
                    () -> gateway.sendMessage(settings.forwardChatId(), text));
            if (!secondary.result().isSuccess()) {
                LOG.errorf("Error sending message to %d: %s", settings.forwardChatId(), secondary.result().detail());
            }
        }
        return DeliveryReceipt.delivered(attempted.result().messageId(), attempted.failures());
    }

    /**
     * Delete the error notice posted for this path, if there is one. The notice
     * stays remembered when deletion keeps failing so a later success retries it.
     */
    public void retractErrorNotice(String sourcePath) throws InterruptedException {
        Optional<Long> notice = pendingErrors.find(sourcePath);
        if (notice.isEmpty()) {
            return;
        }
        long messageId = notice.get();
        Attempted attempted = withRetries(control, "error notice deletion",
                () -> gateway.deleteMessage(settings.primaryChatId(), messageId));
        SendResult result = attempted.result();
        if (result.isSuccess()) {
            pendingErrors.remove(sourcePath);
            LOG.infof("Retracted error notice %d for %s", messageId, sourcePath);
        } else if (result.failureKind() == SendResult.FailureKind.REJECTED) {
            // already gone on the remote side
            pendingErrors.remove(sourcePath);
            LOG.warnf("Error notice %d for %s could not be deleted (%s), forgetting it",
                    messageId, sourcePath, result.detail());
        } else {
            LOG.warnf("Could not retract error notice %d for %s after %d attempts: %s",
                    messageId, sourcePath, attempted.failures(), result.detail());
        }
    }

    private void postErrorNotice(DeliveryUnit unit) throws InterruptedException {
        if (pendingErrors.has(unit.sourcePath())) {
            LOG.debugf("Error notice already posted for %s", unit.sourcePath());
            return;
        }
        control.acquire();
        SendResult notice = gateway.sendMessage(settings.primaryChatId(), CaptionFormatter.errorNotice(unit.label()));
        if (notice.isSuccess()) {
            pendingErrors.remember(unit.sourcePath(), notice.messageId());
        } else {
            LOG.warnf("Could not post error notice for %s: %s", unit.sourcePath(), notice.detail());
        }
    }

    private void forward(long messageId) throws InterruptedException {
        if (!settings.forwardEnabled()) {
            return;
        }
        MembershipStatus status = MembershipStatus.UNKNOWN;
        OptionalLong self = selfId();
        if (self.isPresent()) {
            control.acquire();
            status = gateway.membershipStatus(settings.forwardChatId(), self.getAsLong());
        }
        if (!status.canReceive()) {
            LOG.errorf("Not a member of chat %d (%s), skipping forward", settings.forwardChatId(), status);
            return;
        }
        control.acquire();
        SendResult result = gateway.forwardMessage(settings.forwardChatId(), settings.primaryChatId(), messageId);
        if (result.isSuccess()) {
            LOG.infof("Message forwarded to %d", settings.forwardChatId());
        } else {
            LOG.errorf("Error forwarding message to %d: %s", settings.forwardChatId(), result.detail());
        }
    }

    private OptionalLong selfId() throws InterruptedException {
        Long cached = selfId;
        if (cached != null) {
            return OptionalLong.of(cached);
        }
        control.acquire();
        OptionalLong identity = gateway.identity();
        if (identity.isPresent()) {
            selfId = identity.getAsLong();
        } else {
            LOG.warnf("Own identity unknown, forwarding to %d without a membership check", settings.forwardChatId());
        }
        return identity;
    }

    private Attempted withRetries(QuotaPool pool, String what, Supplier<SendResult> call) throws InterruptedException {
        int failures = 0;
        SendResult result;
        while (true) {
            pool.acquire();
            result = call.get();
            switch (result.status()) {
                case SUCCESS:
                    return new Attempted(result, failures);
                case RETRY_AFTER:
                    LOG.warnf("Rate limited sending %s, waiting %s", what, result.retryAfter());
                    sleeper.sleep(result.retryAfter());
                    break;
                case FAILURE:
                default:
                    failures++;
                    if (failures >= settings.maxAttempts()) {
                        return new Attempted(result, failures);
                    }
                    LOG.warnf("Attempt %d/%d sending %s failed (%s), retrying in %s",
                            failures, settings.maxAttempts(), what, result.detail(), settings.retryDelay());
                    sleeper.sleep(settings.retryDelay());
                    break;
            }
        }
    }

    private record Attempted(SendResult result, int failures) {
    }
}
