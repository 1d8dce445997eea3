package com.pixshare.service;

import com.pixshare.config.StorageConfig;
import com.pixshare.model.Photo;
import com.pixshare.model.StoragePath;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Files on disk under the configured storage root. Every path handed in is a
 * {@link StoragePath}; {@link #open(String)} re-checks that the resolved file
 * stays below the root.
 */
@Component
public class PhotoStorage {

    private static final Logger log = LoggerFactory.getLogger(PhotoStorage.class);

    private final StorageConfig storageConfig;

    public PhotoStorage(StorageConfig storageConfig) {
        this.storageConfig = storageConfig;
    }

    public boolean exists(StoragePath path) {
        return Files.exists(resolve(path.toString()));
    }

    /**
     * Writes the original as uploaded and a square thumbnail next to it.
     */
    public void write(StoragePath path, MultipartFile file) throws IOException {
        Path original = resolve(path.toString());
        Path thumb = resolve(path.thumbnail().toString());
        Files.createDirectories(original.getParent());
        Files.createDirectories(thumb.getParent());

        try (InputStream in = file.getInputStream()) {
            Files.copy(in, original, StandardCopyOption.REPLACE_EXISTING);
        }
        int size = storageConfig.getThumbnailSize();
        try {
            Thumbnails.of(original.toFile())
                .size(size, size)
                .crop(Positions.CENTER)
                .toFile(thumb.toFile());
        } catch (IOException e) {
            Files.deleteIfExists(original);
            throw e;
        }
    }

    public void deleteFiles(Photo photo) {
        delete(photo.storagePath());
        String thumb = photo.thumbnailPath();
        if (thumb != null) {
            delete(thumb);
        }
    }

    public Optional<Resource> open(String storagePath) {
        Path file = resolve(storagePath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(new FileSystemResource(file));
    }

    private void delete(String storagePath) {
        try {
            Files.deleteIfExists(resolve(storagePath));
        } catch (IOException e) {
            log.warn("Could not delete {}", storagePath, e);
        }
    }

    private Path resolve(String storagePath) {
        Path root = Path.of(storageConfig.getRoot()).toAbsolutePath().normalize();
        Path file = root.resolve(storagePath).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the storage root: " + storagePath);
        }
        return file;
    }
}
