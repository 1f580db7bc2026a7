package com.lbg.markets.surveillance.courier.archive;

import com.lbg.markets.surveillance.courier.domain.ArchiveSpec;
import com.lbg.markets.surveillance.courier.domain.CompressionMode;
import jakarta.enterprise.context.ApplicationScoped;
import net.lingala.zip4j.io.outputstream.ZipOutputStream;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.AesKeyStrength;
import net.lingala.zip4j.model.enums.CompressionLevel;
import net.lingala.zip4j.model.enums.CompressionMethod;
import net.lingala.zip4j.model.enums.EncryptionMethod;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Locale;

/**
 * Turns a source file into a single zip container holding that one file,
 * optionally AES-encrypted. Sources that need no container are passed through.
 */
@ApplicationScoped
public class Archiver {

    private static final Logger LOG = Logger.getLogger(Archiver.class);

    private static final String ZIP_SUFFIX = ".zip";
    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * @param source  file to package
     * @param spec    compression and encryption settings
     * @param workDir scratch directory the container is created in
     */
    public Artifact archive(Path source, ArchiveSpec spec, Path workDir) throws ArchiveException {
        String baseName = source.getFileName().toString();
        boolean alreadyZip = baseName.toLowerCase(Locale.ROOT).endsWith(ZIP_SUFFIX);

        if (spec.compression() == CompressionMode.NONE || (alreadyZip && !spec.encryptionEnabled())) {
            LOG.debugf("Sending %s as-is (compression %s)", source, spec.compression());
            return Artifact.passThrough(source, alreadyZip);
        }

        Path target = workDir.resolve(baseName + ZIP_SUFFIX);
        LOG.infof("Compressing file: %s into %s", source, target);

        ZipParameters parameters = parametersFor(source, spec);
        try (OutputStream file = Files.newOutputStream(target);
             ZipOutputStream zip = open(file, spec);
             InputStream in = Files.newInputStream(source)) {
            zip.putNextEntry(parameters);
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                zip.write(buffer, 0, read);
            }
            zip.closeEntry();
        } catch (IOException e) {
            deleteQuietly(target, e);
            throw translate(source, spec, e);
        }
        return new Artifact(target, true, true, spec.encryptionEnabled());
    }

    private static ZipOutputStream open(OutputStream out, ArchiveSpec spec) throws IOException {
        if (spec.encryptionEnabled()) {
            return new ZipOutputStream(out, spec.passphrase().toCharArray());
        }
        return new ZipOutputStream(out);
    }

    private static ZipParameters parametersFor(Path source, ArchiveSpec spec) throws ArchiveException {
        ZipParameters parameters = new ZipParameters();
        parameters.setFileNameInZip(source.getFileName().toString());
        parameters.setCompressionMethod(CompressionMethod.DEFLATE);
        parameters.setCompressionLevel(spec.compression() == CompressionMode.FAST
                ? CompressionLevel.FASTEST
                : CompressionLevel.NORMAL);
        if (spec.encryptionEnabled()) {
            parameters.setEncryptFiles(true);
            parameters.setEncryptionMethod(EncryptionMethod.AES);
            parameters.setAesKeyStrength(AesKeyStrength.KEY_STRENGTH_256);
        }
        try {
            parameters.setLastModifiedFileTime(Files.getLastModifiedTime(source).toMillis());
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Reason.IO, "Cannot stat " + source, e);
        }
        return parameters;
    }

    static ArchiveException translate(Path source, ArchiveSpec spec, IOException e) {
        if (e instanceof ArchiveException archiveException) {
            return archiveException;
        }
        if (e instanceof AccessDeniedException) {
            return new ArchiveException(ArchiveException.Reason.PERMISSION_DENIED,
                    "Permission denied while archiving " + source, e);
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("no space left") || message.contains("disk full")) {
            return new ArchiveException(ArchiveException.Reason.DISK_FULL,
                    "Scratch storage full while archiving " + source, e);
        }
        if (spec.encryptionEnabled() && e.getCause() instanceof GeneralSecurityException) {
            return new ArchiveException(ArchiveException.Reason.ENCRYPTION_CONFIG,
                    "Encryption failed for " + source, e);
        }
        return new ArchiveException(ArchiveException.Reason.IO, "Failed to archive " + source, e);
    }

    private static void deleteQuietly(Path target, IOException failure) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
