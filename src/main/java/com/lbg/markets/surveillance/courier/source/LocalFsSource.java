package com.lbg.markets.surveillance.courier.source;

import com.lbg.markets.surveillance.courier.domain.FileDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks monitored folders on the local filesystem.
 * Unreadable entries and missing roots are logged and left out of the listing.
 */
@ApplicationScoped
public class LocalFsSource implements SourceProvider {

    private static final Logger LOG = Logger.getLogger(LocalFsSource.class);

    @Override
    public List<FileDescriptor> list(List<Path> roots) {
        List<FileDescriptor> found = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                LOG.warnf("Monitored folder does not exist or is not a directory: %s", root);
                continue;
            }
            try {
                Files.walkFileTree(root, new Collector(found));
            } catch (IOException e) {
                LOG.errorf(e, "Failed to list monitored folder: %s", root);
            }
        }
        return found;
    }

    private static final class Collector extends SimpleFileVisitor<Path> {

        private final List<FileDescriptor> found;

        Collector(List<FileDescriptor> found) {
            this.found = found;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                found.add(new FileDescriptor(
                        file.toString(),
                        attrs.size(),
                        attrs.lastModifiedTime().toMillis()
                ));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            LOG.warnf("Skipping unreadable entry %s: %s", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }
}
