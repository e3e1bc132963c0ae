package com.ryuqq.statestore.core.spi;

import java.io.IOException;

/**
 * Read-only filesystem SPI queried during consistency verification.
 *
 * <p>Implementations answer existence and modification-time questions for the paths named in
 * class records. They never write.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>A path that does not exist yields {@link FileMetadata#missing()}, not an exception</li>
 *   <li>Any other failure to read metadata is reported as {@link IOException}</li>
 *   <li>Thread-safe: may be called from multiple threads at once</li>
 * </ul>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FileMetadataProvider {

    /**
     * Reads metadata of the given file.
     *
     * @param filePath path exactly as stored in the class record
     * @return file metadata
     * @throws IOException if metadata cannot be read for a reason other than absence
     */
    FileMetadata stat(String filePath) throws IOException;
}
