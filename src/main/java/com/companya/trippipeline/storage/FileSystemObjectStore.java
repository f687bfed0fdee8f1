package com.companya.trippipeline.storage;

import com.companya.trippipeline.exception.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps each bucket as a directory under a root path; object keys map to
 * relative file paths. Content types are not persisted.
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;

    public FileSystemObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public byte[] get(String bucket, String key) {
        Path path = resolve(bucket, key);
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new ObjectStoreException("Failed to read " + bucket + "/" + key, ex);
        }
    }

    @Override
    public void put(String bucket, String key, byte[] content, String contentType) {
        Path path = resolve(bucket, key);
        try {
            Files.createDirectories(path.getParent());
            // readers never see a partially written object
            Path tmp = Files.createTempFile(path.getParent(), ".upload-", ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored {} bytes at {} ({})", content.length, path, contentType);
        } catch (IOException ex) {
            throw new ObjectStoreException("Failed to write " + bucket + "/" + key, ex);
        }
    }

    private Path resolve(String bucket, String key) {
        if (bucket == null || bucket.isBlank() || key == null || key.isBlank()) {
            throw new IllegalArgumentException("Bucket and key are required");
        }
        Path bucketDir = root.resolve(bucket).normalize();
        Path path = bucketDir.resolve(key).normalize();
        if (!bucketDir.startsWith(root) || !path.startsWith(bucketDir)) {
            throw new IllegalArgumentException("Key escapes bucket: " + bucket + "/" + key);
        }
        return path;
    }
}
