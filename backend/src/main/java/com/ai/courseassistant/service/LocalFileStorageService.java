package com.ai.courseassistant.service;

import com.ai.courseassistant.config.CourseAssistantProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Stores uploaded PDFs under the configured upload directory as
 * {@code <documentId>_<filename>}.
 */
@Slf4j
@Service
public class LocalFileStorageService {

    private final Path storageDirectory;

    public LocalFileStorageService(CourseAssistantProperties properties) {
        this.storageDirectory = Paths.get(properties.getStorage().getUploadDir()).toAbsolutePath().normalize();
    }

    public Path save(String documentId, String filename, InputStream content) throws IOException {
        Files.createDirectories(storageDirectory);

        Path target = storageDirectory.resolve(documentId + "_" + sanitize(filename)).normalize();
        if (!target.startsWith(storageDirectory)) {
            throw new IOException("Refusing to store file outside the upload directory: " + filename);
        }

        Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);

        if (Files.size(target) == 0) {
            throw new IOException("File was not properly saved: " + target);
        }

        log.info("Saved file for document {} to {} (size: {} bytes)", documentId, target, Files.size(target));
        return target;
    }

    /**
     * Best-effort removal; a missing file is not an error.
     *
     * @return true when a file was deleted
     */
    public boolean delete(String filePath) {
        try {
            boolean deleted = Files.deleteIfExists(Paths.get(filePath));
            if (deleted) {
                log.info("Deleted stored file {}", filePath);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Failed to delete stored file {}: {}", filePath, e.getMessage());
            return false;
        }
    }

    private static String sanitize(String filename) {
        String name = Paths.get(filename).getFileName().toString();
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
