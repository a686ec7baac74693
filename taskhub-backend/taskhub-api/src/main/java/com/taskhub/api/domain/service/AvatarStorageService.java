package com.taskhub.api.domain.service;

import com.taskhub.api.config.TaskHubProperties;
import com.taskhub.api.domain.exception.AvatarStorageException;
import com.taskhub.api.domain.validation.ImageFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Stores avatar uploads on the local disk under {@code <avatar-dir>/uploads} and hands back
 * the relative path that is saved on the user record.
 */
@Service
@Slf4j
public class AvatarStorageService {

    private static final String UPLOAD_FOLDER = "uploads";
    private static final int HEADER_BYTES = 512;

    private final Path root;

    public AvatarStorageService(TaskHubProperties properties) {
        this.root = Paths.get(properties.getStorage().getAvatarDir()).toAbsolutePath().normalize();
    }

    /**
     * @return path relative to the storage root, e.g. {@code uploads/5f0c...png}
     */
    public String store(MultipartFile file) {
        try {
            Path folder = Files.createDirectories(root.resolve(UPLOAD_FOLDER));
            String extension = detectExtension(file);
            String fileName = UUID.randomUUID() + "." + extension;
            Path target = folder.resolve(fileName);

            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target);
            }

            String relativePath = UPLOAD_FOLDER + "/" + fileName;
            log.info("[AVATAR_STORED] Avatar written to disk | path={} | bytes={}", relativePath, file.getSize());
            return relativePath;
        } catch (IOException e) {
            log.error("[AVATAR_STORE_FAILED] Could not store avatar | error={}", e.getMessage(), e);
            throw new AvatarStorageException("Could not store avatar", e);
        }
    }

    /**
     * Delete a previously stored avatar. Used for cleanup, so a failure is logged and not raised.
     */
    public void delete(String relativePath) {
        if (relativePath == null) {
            return;
        }
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) {
            log.warn("[AVATAR_DELETE_SKIPPED] Path escapes storage root | path={}", relativePath);
            return;
        }
        try {
            boolean deleted = Files.deleteIfExists(target);
            log.debug("[AVATAR_DELETED] Avatar cleanup | path={} | deleted={}", relativePath, deleted);
        } catch (IOException e) {
            log.warn("[AVATAR_DELETE_FAILED] Could not delete avatar | path={} | error={}", relativePath, e.getMessage());
        }
    }

    private static String detectExtension(MultipartFile file) throws IOException {
        try (InputStream in = new BufferedInputStream(file.getInputStream())) {
            return ImageFormat.detect(in.readNBytes(HEADER_BYTES))
                    .map(ImageFormat::getExtension)
                    .orElse("img");
        }
    }
}
