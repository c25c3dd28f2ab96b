package org.drinkmap.driver.storage;

import com.typesafe.config.Config;
import org.drinkmap.driver.DriverConfigurationException;
import org.drinkmap.driver.IDriver;
import org.drinkmap.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Produces the shared {@link FileSystemBlobStore}.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code root-directory} (required): absolute path, {@code ${VAR}} references are expanded</li>
 *   <li>{@code default-bucket}: bucket used when a call names none</li>
 * </ul>
 */
public class StorageDriver implements IDriver<FileSystemBlobStore> {

    public static final String NAME = "storage";

    private static final Logger LOGGER = LoggerFactory.getLogger(StorageDriver.class);

    @Override
    public FileSystemBlobStore initialize(final Config options) throws IOException {
        if (!options.hasPath("root-directory")) {
            throw new DriverConfigurationException(NAME, "root-directory is required for the storage driver");
        }
        final String expanded;
        try {
            expanded = PathExpansion.expand(options.getString("root-directory"));
        } catch (final IllegalArgumentException e) {
            throw new DriverConfigurationException(NAME, e.getMessage());
        }
        final Path root = Paths.get(expanded);
        if (!root.isAbsolute()) {
            throw new DriverConfigurationException(NAME, "root-directory must be an absolute path: " + expanded);
        }
        Files.createDirectories(root);

        final String defaultBucket = options.hasPath("default-bucket") ? options.getString("default-bucket") : null;
        LOGGER.debug("Blob store rooted at {} (default bucket: {})", root, defaultBucket);
        return new FileSystemBlobStore(root, defaultBucket);
    }

    @Override
    public void cleanup(final FileSystemBlobStore instance) {
        instance.close();
    }

    @Override
    public boolean healthCheck(final FileSystemBlobStore instance) throws IOException {
        if (instance.isClosed()) {
            return false;
        }
        final Path root = instance.getRoot();
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            return false;
        }
        instance.listBuckets();
        return true;
    }
}
