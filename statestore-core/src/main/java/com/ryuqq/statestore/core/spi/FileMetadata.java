package com.ryuqq.statestore.core.spi;

import java.time.Instant;

/**
 * Existence and modification time of a file as reported by a {@link FileMetadataProvider}.
 *
 * @param exists whether the file exists
 * @param lastModified last modification time (null when the file does not exist)
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record FileMetadata(boolean exists, Instant lastModified) {

    public FileMetadata {
        if (exists && lastModified == null) {
            throw new IllegalArgumentException("lastModified cannot be null for an existing file");
        }
        if (!exists && lastModified != null) {
            throw new IllegalArgumentException("lastModified must be null for a missing file");
        }
    }

    public static FileMetadata present(Instant lastModified) {
        return new FileMetadata(true, lastModified);
    }

    public static FileMetadata missing() {
        return new FileMetadata(false, null);
    }
}
