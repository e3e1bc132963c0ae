package com.ryuqq.statestore.adapter.inmemory.filesystem;

import com.ryuqq.statestore.core.spi.FileMetadata;
import com.ryuqq.statestore.core.spi.FileMetadataProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * {@link FileMetadataProvider} backed by the local filesystem.
 *
 * <p>Reads {@link BasicFileAttributes} in a single call so that existence and modification time
 * come from the same lookup. Relative paths resolve against the working directory.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class LocalFileMetadataProvider implements FileMetadataProvider {

    @Override
    public FileMetadata stat(String filePath) throws IOException {
        if (filePath == null) {
            throw new IllegalArgumentException("filePath cannot be null");
        }

        Path path;
        try {
            path = Path.of(filePath);
        } catch (InvalidPathException e) {
            throw new IOException("Invalid file path: " + filePath, e);
        }

        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return FileMetadata.present(attributes.lastModifiedTime().toInstant());
        } catch (NoSuchFileException e) {
            return FileMetadata.missing();
        }
    }
}
