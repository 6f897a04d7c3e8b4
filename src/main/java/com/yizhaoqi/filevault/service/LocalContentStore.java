package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.exception.ContentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Flat directory of blobs named by UUID, derivatives named {@code <uuid>_<width>}.
 */
@Service
public class LocalContentStore implements ContentStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalContentStore.class);

    private static final Pattern CONTENT_REF = Pattern.compile("[0-9a-fA-F-]{36}");

    private final Path root;

    public LocalContentStore(@Value("${files.folder-path:/tmp/files_manager}") String folderPath) {
        String path = folderPath == null || folderPath.isBlank() ? "/tmp/files_manager" : folderPath;
        this.root = Paths.get(path).toAbsolutePath();
    }

    @Override
    public String put(byte[] data) throws ContentStoreException {
        String contentRef = UUID.randomUUID().toString();
        write(resolve(contentRef, null), data);
        logger.info("Stored content {} ({} bytes)", contentRef, data.length);
        return contentRef;
    }

    @Override
    public Optional<byte[]> get(String contentRef, Integer width) throws ContentStoreException {
        Path path = resolve(contentRef, width);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ContentStoreException("Failed to read " + path, e);
        }
    }

    @Override
    public void putDerivative(String contentRef, int width, byte[] data) throws ContentStoreException {
        write(resolve(contentRef, width), data);
        logger.debug("Stored derivative {}_{} ({} bytes)", contentRef, width, data.length);
    }

    @Override
    public void delete(String contentRef) {
        try {
            Files.deleteIfExists(resolve(contentRef, null));
        } catch (IOException e) {
            logger.warn("Failed to delete content {}", contentRef, e);
        }
    }

    public Path getRoot() {
        return root;
    }


    private Path resolve(String contentRef, Integer width) throws ContentStoreException {
        if (contentRef == null || !CONTENT_REF.matcher(contentRef).matches()) {
            throw new ContentStoreException("Invalid content reference: " + contentRef, null);
        }
        String name = width == null ? contentRef : contentRef + "_" + width;
        return root.resolve(name);
    }

    // Temp file + atomic move: a blob is either absent or complete.
    private void write(Path target, byte[] data) throws ContentStoreException {
        try {
            Files.createDirectories(root);
            Path temp = Files.createTempFile(root, target.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, data);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new ContentStoreException("Failed to write " + target, e);
        }
    }
}
