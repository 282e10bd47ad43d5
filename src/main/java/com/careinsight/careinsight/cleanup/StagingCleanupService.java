package com.careinsight.careinsight.cleanup;

import com.careinsight.careinsight.imports.ImportConstants;
import com.careinsight.careinsight.imports.StagedFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Best-effort janitor for staged upload files. Deletes by age and by aggregate size; a
 * commit whose file was removed here fails with an invalid-token error.
 */
@Service
public class StagingCleanupService {

    private static final Logger log = LoggerFactory.getLogger(StagingCleanupService.class);

    private static final double BYTES_PER_MB = 1024d * 1024d;
    private static final double MILLIS_PER_HOUR = 3_600_000d;
    private static final double HOURS_PER_WEEK = 24 * 7;

    private final StagedFileStore stagedFileStore;
    private final CleanupProperties cleanupProperties;

    public StagingCleanupService(StagedFileStore stagedFileStore, CleanupProperties cleanupProperties) {
        this.stagedFileStore = stagedFileStore;
        this.cleanupProperties = cleanupProperties;
    }

    public Path getDirectory() {
        return stagedFileStore.getUploadDir();
    }

    public CleanupModels.CleanupStats stats() {
        int totalFiles = 0;
        long totalSize = 0;
        double oldestAge = 0;
        int over24h = 0;
        int over7d = 0;

        for (StagedFile file : listFiles()) {
            totalFiles++;
            totalSize += file.size();
            double age = file.ageHours();
            oldestAge = Math.max(oldestAge, age);
            if (age > 24) {
                over24h++;
            }
            if (age > HOURS_PER_WEEK) {
                over7d++;
            }
        }
        return new CleanupModels.CleanupStats(totalFiles, round(totalSize / BYTES_PER_MB), round(oldestAge), over24h, over7d);
    }

    /**
     * Removes files last modified more than {@code maxAgeHours} ago.
     */
    public CleanupModels.AgeCleanupResult cleanupOldFiles(double maxAgeHours, boolean dryRun) {
        int deleted = 0;
        int kept = 0;
        long freed = 0;

        for (StagedFile file : listFiles()) {
            if (file.ageHours() <= maxAgeHours) {
                kept++;
                continue;
            }
            if (dryRun) {
                log.info("[DRY RUN] Would delete: {} (age: {}h, size: {} KB)",
                        file.path().getFileName(), round(file.ageHours()), file.size() / 1024);
                deleted++;
                freed += file.size();
            } else if (delete(file.path())) {
                deleted++;
                freed += file.size();
                log.info("Deleted: {} (age: {}h)", file.path().getFileName(), round(file.ageHours()));
            } else {
                kept++;
            }
        }

        if (!dryRun) {
            log.info("Cleanup complete: deleted {} files, kept {} files, freed {} MB", deleted, kept, round(freed / BYTES_PER_MB));
        }
        return new CleanupModels.AgeCleanupResult(deleted, kept, round(freed / BYTES_PER_MB));
    }

    /**
     * Deletes oldest files first until the directory fits within {@code maxSizeMb}.
     */
    public CleanupModels.SizeCleanupResult cleanupBySizeLimit(double maxSizeMb, boolean dryRun) {
        List<StagedFile> files = listFiles();
        long limit = (long) (maxSizeMb * BYTES_PER_MB);
        long current = files.stream().mapToLong(StagedFile::size).sum();
        if (current <= limit) {
            log.debug("Directory size ({} MB) is within limit ({} MB)", round(current / BYTES_PER_MB), maxSizeMb);
            return new CleanupModels.SizeCleanupResult(0, 0);
        }

        files.sort(Comparator.comparingLong(StagedFile::lastModifiedMillis));
        int deleted = 0;
        long freed = 0;
        for (StagedFile file : files) {
            if (current - freed <= limit) {
                break;
            }
            if (dryRun) {
                log.info("[DRY RUN] Would delete: {} (size: {} KB)", file.path().getFileName(), file.size() / 1024);
                deleted++;
                freed += file.size();
            } else if (delete(file.path())) {
                deleted++;
                freed += file.size();
                log.info("Deleted (size limit): {}", file.path().getFileName());
            }
        }

        if (!dryRun) {
            log.info("Size-based cleanup: deleted {} files, freed {} MB", deleted, round(freed / BYTES_PER_MB));
        }
        return new CleanupModels.SizeCleanupResult(deleted, round(freed / BYTES_PER_MB));
    }

    /**
     * Runs age cleanup then size cleanup and reports the directory before and after.
     */
    public CleanupModels.CleanupResult runCleanup(double maxAgeHours, double maxSizeMb) {
        log.info("Starting cleanup for {}", getDirectory());
        CleanupModels.CleanupStats before = stats();
        CleanupModels.AgeCleanupResult age = cleanupOldFiles(maxAgeHours, false);
        CleanupModels.SizeCleanupResult size = cleanupBySizeLimit(maxSizeMb, false);
        CleanupModels.CleanupStats after = stats();

        return new CleanupModels.CleanupResult(
                LocalDateTime.now().toString(),
                before,
                after,
                age,
                size,
                age.filesDeleted() + size.filesDeleted(),
                round(age.spaceFreedMb() + size.spaceFreedMb())
        );
    }

    public CleanupModels.CleanupResult runConfiguredCleanup() {
        return runCleanup(cleanupProperties.getMaxAgeHours(), cleanupProperties.getMaxSizeMb());
    }

    /**
     * Deletes every staged file regardless of age. In-flight imports lose their tokens.
     */
    public CleanupModels.ClearAllResponse clearAll() {
        int deleted = 0;
        long freed = 0;
        for (StagedFile file : listFiles()) {
            if (delete(file.path())) {
                deleted++;
                freed += file.size();
            }
        }
        log.warn("Cleared all staged uploads: deleted {} files", deleted);
        return new CleanupModels.ClearAllResponse(true, deleted, round(freed / BYTES_PER_MB),
                "All upload files have been deleted");
    }

    private List<StagedFile> listFiles() {
        Path directory = getDirectory();
        List<StagedFile> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        long now = System.currentTimeMillis();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile)
                    .filter(path -> !ImportConstants.KEEP_FILE_NAME.equals(path.getFileName().toString()))
                    .forEach(path -> {
                        try {
                            long modified = Files.getLastModifiedTime(path).toMillis();
                            files.add(new StagedFile(path, Files.size(path), modified, (now - modified) / MILLIS_PER_HOUR));
                        } catch (IOException ex) {
                            log.error("Error reading attributes of {}: {}", path, ex.getMessage());
                        }
                    });
        } catch (IOException ex) {
            log.error("Error listing {}: {}", directory, ex.getMessage());
        }
        return files;
    }

    /**
     * Returns {@code true} only if this call removed the file; one already removed by a
     * commit or another cleanup run is not counted.
     */
    boolean delete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.error("Failed to delete {}: {}", path, ex.getMessage());
            return false;
        }
    }

    private static double round(double value) {
        return Math.round(value * 100d) / 100d;
    }

    private record StagedFile(Path path, long size, long lastModifiedMillis, double ageHours) {
    }
}
