package com.lbg.markets.surveillance.courier.sink;

import com.lbg.markets.surveillance.courier.config.CourierConfig;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local stand-in for the remote endpoint, for development and tests.
 * Each chat is a directory under the outbox; each message is a file named
 * after its message id.
 */
@ApplicationScoped
@IfBuildProfile(anyOf = {"dev", "test"})
public class LocalFsGateway implements ChatGateway {

    private static final Logger LOG = Logger.getLogger(LocalFsGateway.class);

    private final Path basePath;
    private final int bufferSize;
    private final AtomicLong nextMessageId = new AtomicLong(System.currentTimeMillis());

    @Inject
    public LocalFsGateway(CourierConfig config) {
        this(Paths.get(config.gateway().localOutbox()), 8192);
    }

    public LocalFsGateway(Path basePath, int bufferSize) {
        this.basePath = basePath;
        this.bufferSize = bufferSize;
    }

    public Path chatDirectory(long chatId) {
        return basePath.resolve(Long.toString(chatId));
    }

    @Override
    public SendResult sendDocument(long chatId, Path document, String caption) {
        long messageId = nextMessageId.incrementAndGet();
        Path target = chatDirectory(chatId).resolve(messageId + "-" + document.getFileName());
        try (InputStream in = Files.newInputStream(document)) {
            write(target, in);
            Files.writeString(target.resolveSibling(messageId + ".caption"), caption, StandardCharsets.UTF_8);
            LOG.debugf("Stored document %s as message %d in chat %d", document.getFileName(), messageId, chatId);
            return SendResult.success(messageId);
        } catch (IOException e) {
            LOG.errorf(e, "Failed to store document %s", document);
            return SendResult.failure(SendResult.FailureKind.NETWORK, e.getMessage());
        }
    }

    @Override
    public SendResult sendMessage(long chatId, String text) {
        long messageId = nextMessageId.incrementAndGet();
        Path target = chatDirectory(chatId).resolve(messageId + ".txt");
        try (InputStream in = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8))) {
            write(target, in);
            return SendResult.success(messageId);
        } catch (IOException e) {
            LOG.errorf(e, "Failed to store message in chat %d", chatId);
            return SendResult.failure(SendResult.FailureKind.NETWORK, e.getMessage());
        }
    }

    @Override
    public SendResult forwardMessage(long toChatId, long fromChatId, long messageId) {
        long forwardedId = nextMessageId.incrementAndGet();
        try (DirectoryStream<Path> matches = Files.newDirectoryStream(chatDirectory(fromChatId), messageId + "-*")) {
            for (Path original : matches) {
                String name = original.getFileName().toString();
                Path target = chatDirectory(toChatId).resolve(forwardedId + name.substring(name.indexOf('-')));
                try (InputStream in = Files.newInputStream(original)) {
                    write(target, in);
                }
                return SendResult.success(forwardedId);
            }
            return SendResult.failure(SendResult.FailureKind.REJECTED, "message " + messageId + " not found");
        } catch (IOException e) {
            LOG.errorf(e, "Failed to forward message %d to chat %d", messageId, toChatId);
            return SendResult.failure(SendResult.FailureKind.NETWORK, e.getMessage());
        }
    }

    @Override
    public SendResult deleteMessage(long chatId, long messageId) {
        Path dir = chatDirectory(chatId);
        if (!Files.isDirectory(dir)) {
            return SendResult.failure(SendResult.FailureKind.REJECTED, "message " + messageId + " not found");
        }
        boolean deleted = false;
        try (DirectoryStream<Path> matches = Files.newDirectoryStream(dir, messageId + "[-.]*")) {
            for (Path match : matches) {
                deleted |= Files.deleteIfExists(match);
            }
        } catch (IOException e) {
            return SendResult.failure(SendResult.FailureKind.NETWORK, e.getMessage());
        }
        return deleted
                ? SendResult.success(messageId)
                : SendResult.failure(SendResult.FailureKind.REJECTED, "message " + messageId + " not found");
    }

    @Override
    public OptionalLong identity() {
        return OptionalLong.of(0);
    }

    @Override
    public MembershipStatus membershipStatus(long chatId, long userId) {
        return MembershipStatus.MEMBER;
    }

    private void write(Path target, InputStream in) throws IOException {
        Files.createDirectories(target.getParent());

        // Use temp file then atomic rename so readers never see a partial message
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                byte[] buffer = new byte[bufferSize];
                int bytesRead;
                while ((bytesRead = in.read(buffer)) != -1) {
                    out.write(buffer, 0, bytesRead);
                }
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
