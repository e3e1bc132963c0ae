package com.ryuqq.statestore.testkit.fs;

import com.ryuqq.statestore.core.spi.FileMetadata;
import com.ryuqq.statestore.core.spi.FileMetadataProvider;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link FileMetadataProvider} for tests.
 *
 * <p>Files are plain path strings mapped to a modification time. Paths can be marked unreadable,
 * in which case {@link #stat(String)} throws {@link IOException}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FakeFileSystem files = new FakeFileSystem()
 *     .put("/work/demo/src/Foo.java", T0);
 * StateStore store = new InMemoryStateStore(new StateStoreConfig(), files);
 *
 * files.touch("/work/demo/src/Foo.java", T0.plusSeconds(5));
 * assertFalse(store.verifyStateConsistency().consistent());
 * </pre>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class FakeFileSystem implements FileMetadataProvider {

    private final Map<String, Instant> files = new ConcurrentHashMap<>();
    private final Set<String> unreadable = ConcurrentHashMap.newKeySet();
    private final AtomicInteger statCount = new AtomicInteger();

    /**
     * Creates or replaces a file.
     *
     * @param path file path
     * @param lastModified modification time
     * @return this
     */
    public FakeFileSystem put(String path, Instant lastModified) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (lastModified == null) {
            throw new IllegalArgumentException("lastModified cannot be null");
        }
        files.put(path, lastModified);
        return this;
    }

    /**
     * Changes the modification time of an existing file.
     *
     * @throws IllegalStateException if the file does not exist
     */
    public FakeFileSystem touch(String path, Instant lastModified) {
        if (!files.containsKey(path)) {
            throw new IllegalStateException("No such file: " + path);
        }
        return put(path, lastModified);
    }

    public FakeFileSystem delete(String path) {
        files.remove(path);
        return this;
    }

    /**
     * Makes every later {@link #stat(String)} of the path fail.
     */
    public FakeFileSystem failOn(String path) {
        unreadable.add(path);
        return this;
    }

    public boolean exists(String path) {
        return files.containsKey(path);
    }

    /**
     * @return number of stat calls so far
     */
    public int statCount() {
        return statCount.get();
    }

    public void clear() {
        files.clear();
        unreadable.clear();
        statCount.set(0);
    }

    @Override
    public FileMetadata stat(String filePath) throws IOException {
        statCount.incrementAndGet();
        if (unreadable.contains(filePath)) {
            throw new IOException("Permission denied: " + filePath);
        }
        Instant lastModified = files.get(filePath);
        return lastModified == null ? FileMetadata.missing() : FileMetadata.present(lastModified);
    }
}
