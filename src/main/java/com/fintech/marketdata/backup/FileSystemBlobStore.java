package com.fintech.marketdata.backup;

import com.fintech.marketdata.config.MarketDataProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Stores blobs as files in a local directory. Used for development and tests.
 *
 * <p>Each write goes to a temporary file that is then moved over the target, so a
 * reader never sees a partially written blob.
 */
@Component
@ConditionalOnExpression("${market-data.backup.enabled:true} and '${market-data.backup.store:azure}' == 'filesystem'")
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private final Path directory;

    @Autowired
    public FileSystemBlobStore(MarketDataProperties properties) throws IOException {
        this(Paths.get(properties.getBackup().getFilesystem().getDirectory()));
    }

    public FileSystemBlobStore(Path directory) throws IOException {
        this.directory = Files.createDirectories(directory.toAbsolutePath());
        log.info("Filesystem blob store ready: {}", this.directory);
    }

    @Override
    public void writeBlob(String name, byte[] content) throws IOException {
        Path target = resolve(name);
        Path temp = Files.createTempFile(directory, ".upload-", ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public String describe() {
        return "file:" + directory;
    }

    public Path directory() {
        return directory;
    }

    Path resolve(String name) {
        Path target = directory.resolve(name).normalize();
        if (!target.getParent().equals(directory)) {
            throw new IllegalArgumentException("Blob name escapes the backup directory: " + name);
        }
        return target;
    }
}
