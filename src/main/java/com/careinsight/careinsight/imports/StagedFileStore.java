package com.careinsight.careinsight.imports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Durable temp storage for uploaded files. Each file is named by a random staging token;
 * the client's filename only contributes a sanitized extension.
 */
@Component
public class StagedFileStore {

    private static final Logger log = LoggerFactory.getLogger(StagedFileStore.class);

    private static final Pattern TOKEN_PATTERN = Pattern.compile("^[0-9a-f]{32}(\\.[A-Za-z0-9]{1,10})+$");
    private static final Pattern SUFFIX_PART_PATTERN = Pattern.compile("^[A-Za-z0-9]{1,10}$");

    private final Path uploadDir;

    public StagedFileStore(ImportProperties importProperties) {
        this.uploadDir = Paths.get(importProperties.getUploadDir()).toAbsolutePath().normalize();
    }

    public Path getUploadDir() {
        return uploadDir;
    }

    /**
     * Copies the stream into a new file under a fresh token and returns the token.
     */
    public String stage(String originalFilename, InputStream content) {
        String token = UUID.randomUUID().toString().replace("-", "") + suffixOf(originalFilename);
        Path target = uploadDir.resolve(token);
        try {
            Files.createDirectories(uploadDir);
            Files.copy(content, target);
        } catch (IOException ex) {
            deleteQuietly(target);
            throw new IllegalStateException(ImportConstants.MSG_SAVE_FAILED + ": " + ex.getMessage(), ex);
        }
        log.info("Staged upload {} as {}", originalFilename, token);
        return token;
    }

    /**
     * Resolves a token to its staged file.
     *
     * @throws InvalidTokenException when the token is blank, malformed or has no file
     */
    public Path resolve(String token) {
        String trimmed = token == null ? "" : token.trim();
        if (!TOKEN_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidTokenException();
        }
        Path path = uploadDir.resolve(trimmed).normalize();
        if (!path.startsWith(uploadDir) || !Files.isRegularFile(path)) {
            throw new InvalidTokenException();
        }
        return path;
    }

    /**
     * Removes the token's file. Returns {@code false} if nothing was deleted.
     */
    public boolean delete(String token) {
        String trimmed = token == null ? "" : token.trim();
        if (!TOKEN_PATTERN.matcher(trimmed).matches()) {
            return false;
        }
        return deleteQuietly(uploadDir.resolve(trimmed));
    }

    private boolean deleteQuietly(Path path) {
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted) {
                log.info("Deleted temporary file: {}", path);
            }
            return deleted;
        } catch (IOException ex) {
            log.warn("Failed to delete temporary file {}: {}", path, ex.getMessage());
            return false;
        }
    }

    /**
     * Keeps every safe extension part of the original name (".csv", ".csv.gz"), else ".csv".
     */
    private String suffixOf(String originalFilename) {
        if (originalFilename == null) {
            return ImportConstants.DEFAULT_STAGED_SUFFIX;
        }
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int firstDot = name.indexOf('.', 1);
        if (firstDot < 0) {
            return ImportConstants.DEFAULT_STAGED_SUFFIX;
        }

        List<String> parts = new ArrayList<>();
        for (String part : name.substring(firstDot + 1).split("\\.")) {
            if (!SUFFIX_PART_PATTERN.matcher(part).matches()) {
                return ImportConstants.DEFAULT_STAGED_SUFFIX;
            }
            parts.add(part.toLowerCase(Locale.ROOT));
        }
        return "." + String.join(".", parts);
    }
}
