package org.drinkmap.driver.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Bucket/object store on the local filesystem, produced by {@link StorageDriver}.
 * <p>
 * A bucket is a directory below the root, an object a file below its bucket. Object names
 * use {@code /} as separator. Writes go to a temporary file first and are moved into place
 * atomically, so readers never observe a partially written object.
 */
public final class FileSystemBlobStore implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemBlobStore.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;
    private final String defaultBucket;
    private volatile boolean closed = false;

    FileSystemBlobStore(final Path root, final String defaultBucket) {
        this.root = Objects.requireNonNull(root, "root");
        this.defaultBucket = defaultBucket;
    }

    /**
     * Writes an object into the default bucket.
     *
     * @param objectName The object name.
     * @param data       The content.
     * @throws IOException if writing fails.
     */
    public void upload(final String objectName, final byte[] data) throws IOException {
        upload(null, objectName, data);
    }

    /**
     * Writes an object, replacing any previous content.
     *
     * @param bucket     The bucket, or null for the default bucket.
     * @param objectName The object name.
     * @param data       The content.
     * @throws IOException if writing fails.
     */
    public void upload(final String bucket, final String objectName, final byte[] data) throws IOException {
        final Path target = resolve(bucket, objectName);
        Files.createDirectories(target.getParent());

        final Path temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        Files.write(temp, data);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (final IOException cleanupEx) {
                LOGGER.warn("Failed to remove temp file {} after failed move", temp, cleanupEx);
            }
            throw e;
        }
    }

    public byte[] download(final String objectName) throws IOException {
        return download(null, objectName);
    }

    /**
     * Reads an object.
     *
     * @param bucket     The bucket, or null for the default bucket.
     * @param objectName The object name.
     * @return The content.
     * @throws NoSuchFileException if the object does not exist.
     * @throws IOException if reading fails.
     */
    public byte[] download(final String bucket, final String objectName) throws IOException {
        final Path file = resolve(bucket, objectName);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(objectName);
        }
        return Files.readAllBytes(file);
    }

    public boolean exists(final String bucket, final String objectName) {
        return Files.isRegularFile(resolve(bucket, objectName));
    }

    /**
     * Deletes an object.
     *
     * @param bucket     The bucket, or null for the default bucket.
     * @param objectName The object name.
     * @return true if the object existed.
     * @throws IOException if deleting fails.
     */
    public boolean delete(final String bucket, final String objectName) throws IOException {
        return Files.deleteIfExists(resolve(bucket, objectName));
    }

    /**
     * Lists object names in a bucket, sorted.
     *
     * @param bucket The bucket, or null for the default bucket.
     * @param prefix Only names starting with this prefix; null or empty for all.
     * @return The matching object names.
     * @throws IOException if walking the bucket fails.
     */
    public List<String> list(final String bucket, final String prefix) throws IOException {
        ensureOpen();
        final Path bucketDir = bucketDir(bucket);
        if (!Files.isDirectory(bucketDir)) {
            return Collections.emptyList();
        }
        final String effectivePrefix = prefix == null ? "" : prefix;
        try (Stream<Path> stream = Files.walk(bucketDir)) {
            return stream
                .filter(p -> !p.getFileName().toString().endsWith(TEMP_SUFFIX))
                .filter(Files::isRegularFile)
                .map(p -> bucketDir.relativize(p).toString().replace('\\', '/'))
                .filter(name -> name.startsWith(effectivePrefix))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /**
     * @return The bucket names below the root, sorted.
     * @throws IOException if listing fails.
     */
    public List<String> listBuckets() throws IOException {
        ensureOpen();
        try (Stream<Path> stream = Files.list(root)) {
            return stream
                .filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public Path getRoot() {
        return root;
    }

    public String getDefaultBucket() {
        return defaultBucket;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    private Path resolve(final String bucket, final String objectName) {
        validateName(objectName, "Object name");
        return bucketDir(bucket).resolve(objectName);
    }

    private Path bucketDir(final String bucket) {
        ensureOpen();
        final String effective = bucket != null ? bucket : defaultBucket;
        if (effective == null || effective.isEmpty()) {
            throw new IllegalArgumentException("bucket is required or default-bucket must be configured");
        }
        validateName(effective, "Bucket name");
        if (effective.contains("/")) {
            throw new IllegalArgumentException("Bucket name cannot contain '/': " + effective);
        }
        return root.resolve(effective);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Blob store is closed.");
        }
    }

    private static void validateName(final String name, final String what) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
        if (name.contains("..")) {
            throw new IllegalArgumentException(what + " cannot contain '..': " + name);
        }
        if (name.startsWith("/") || name.startsWith("\\")) {
            throw new IllegalArgumentException(what + " cannot be an absolute path: " + name);
        }
        if (name.length() >= 2 && name.charAt(1) == ':') {
            throw new IllegalArgumentException(what + " cannot contain a drive letter: " + name);
        }
    }
}
