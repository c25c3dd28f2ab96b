package org.drinkmap.driver.storage;

import com.typesafe.config.ConfigFactory;
import org.drinkmap.driver.DriverConfigurationException;
import org.drinkmap.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StorageDriverTest {

    @TempDir
    Path tempDir;

    private final StorageDriver driver = new StorageDriver();

    private FileSystemBlobStore open(final String defaultBucket) throws Exception {
        final Path root = tempDir.resolve("blobs");
        return driver.initialize(ConfigFactory.parseMap(defaultBucket == null
            ? Map.of("root-directory", root.toString())
            : Map.of("root-directory", root.toString(), "default-bucket", defaultBucket)));
    }

    @Test
    void initializeCreatesTheRootDirectory() throws Exception {
        final FileSystemBlobStore store = open("drinkmap");

        assertThat(store.getRoot()).isDirectory();
        assertThat(store.getDefaultBucket()).isEqualTo("drinkmap");
    }

    @Test
    void rootDirectoryIsRequired() {
        assertThatThrownBy(() -> driver.initialize(ConfigFactory.empty()))
            .isInstanceOf(DriverConfigurationException.class)
            .hasMessageContaining("root-directory");
    }

    @Test
    void relativeRootDirectoryIsRejected() {
        assertThatThrownBy(() -> driver.initialize(ConfigFactory.parseMap(Map.of("root-directory", "relative/blobs"))))
            .isInstanceOf(DriverConfigurationException.class)
            .hasMessageContaining("absolute");
    }

    @Test
    void undefinedVariableInRootDirectoryIsAConfigurationError() {
        assertThatThrownBy(() -> driver.initialize(ConfigFactory.parseMap(
            Map.of("root-directory", "${DRINKMAP_SURELY_UNDEFINED_VARIABLE}/blobs"))))
            .isInstanceOf(DriverConfigurationException.class)
            .hasMessageContaining("DRINKMAP_SURELY_UNDEFINED_VARIABLE");
    }

    @Test
    void uploadedObjectsCanBeReadListedAndDeleted() throws Exception {
        final FileSystemBlobStore store = open("drinkmap");
        store.upload("menus/a.json", "{\"a\":1}".getBytes(StandardCharsets.UTF_8));
        store.upload("menus/b.json", "{}".getBytes(StandardCharsets.UTF_8));
        store.upload("other", "x", new byte[] {1, 2, 3});

        assertThat(new String(store.download("menus/a.json"), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
        assertThat(store.list(null, "menus/")).containsExactly("menus/a.json", "menus/b.json");
        assertThat(store.listBuckets()).containsExactly("drinkmap", "other");
        assertThat(store.exists("other", "x")).isTrue();

        assertThat(store.delete("other", "x")).isTrue();
        assertThat(store.delete("other", "x")).isFalse();
        assertThat(store.exists("other", "x")).isFalse();
    }

    @Test
    void uploadReplacesExistingContentWithoutLeavingTempFiles() throws Exception {
        final FileSystemBlobStore store = open("drinkmap");
        store.upload("item", new byte[] {1});
        store.upload("item", new byte[] {2});

        assertThat(store.download("item")).containsExactly(2);
        try (var files = Files.list(store.getRoot().resolve("drinkmap"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("item");
        }
    }

    @Test
    void missingObjectsAndBucketsBehave() throws Exception {
        final FileSystemBlobStore store = open("drinkmap");

        assertThatThrownBy(() -> store.download("nothing")).isInstanceOf(NoSuchFileException.class);
        assertThat(store.list("empty", null)).isEmpty();
    }

    @Test
    void unsafeNamesAreRejected() throws Exception {
        final FileSystemBlobStore store = open("drinkmap");

        assertThatThrownBy(() -> store.upload("../escape", new byte[0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.upload("a/b", "x", new byte[0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.upload("", new byte[0])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void callsWithoutBucketNeedADefaultBucket() throws Exception {
        final FileSystemBlobStore store = open(null);

        assertThatThrownBy(() -> store.upload("x", new byte[0]))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("default-bucket");
    }

    @Test
    void healthReflectsTheStoreState() throws Exception {
        final FileSystemBlobStore store = open("drinkmap");
        assertThat(driver.healthCheck(store)).isTrue();

        driver.cleanup(store);

        assertThat(store.isClosed()).isTrue();
        assertThat(driver.healthCheck(store)).isFalse();
        assertThatThrownBy(() -> store.download("x")).isInstanceOf(IllegalStateException.class);
    }
}
