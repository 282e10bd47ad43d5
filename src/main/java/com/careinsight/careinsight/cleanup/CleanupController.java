package com.careinsight.careinsight.cleanup;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Admin endpoints for inspecting and pruning the staged upload directory.
 */
@RestController
@RequestMapping("/api/cleanup")
public class CleanupController {

    private final StagingCleanupService stagingCleanupService;
    private final CleanupProperties cleanupProperties;

    public CleanupController(StagingCleanupService stagingCleanupService, CleanupProperties cleanupProperties) {
        this.stagingCleanupService = stagingCleanupService;
        this.cleanupProperties = cleanupProperties;
    }

    @GetMapping("/stats")
    public ResponseEntity<CleanupModels.StatsResponse> stats() {
        return ResponseEntity.ok(new CleanupModels.StatsResponse(
                true, stagingCleanupService.stats(), stagingCleanupService.getDirectory().toString()));
    }

    /**
     * Reports what a cleanup with the given limits would delete, without deleting.
     */
    @PostMapping("/preview")
    public ResponseEntity<CleanupModels.PreviewResponse> preview(@RequestBody(required = false) CleanupModels.CleanupRequest request) {
        CleanupModels.Limits limits = limitsOf(request);
        CleanupModels.CleanupStats current = stagingCleanupService.stats();
        CleanupModels.AgeCleanupResult age = stagingCleanupService.cleanupOldFiles(limits.maxAgeHours(), true);
        CleanupModels.SizeCleanupResult size = stagingCleanupService.cleanupBySizeLimit(limits.maxSizeMb(), true);

        return ResponseEntity.ok(new CleanupModels.PreviewResponse(
                true,
                true,
                current,
                new CleanupModels.WouldDelete(age.filesDeleted(), size.filesDeleted(), age.filesDeleted() + size.filesDeleted()),
                Math.round((age.spaceFreedMb() + size.spaceFreedMb()) * 100d) / 100d,
                age.filesKept(),
                limits
        ));
    }

    @PostMapping("/run")
    public ResponseEntity<CleanupModels.RunResponse> run(@RequestBody(required = false) CleanupModels.CleanupRequest request) {
        if (request != null && Boolean.TRUE.equals(request.dryRun())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Use /api/cleanup/preview for dry-run operations");
        }
        CleanupModels.Limits limits = limitsOf(request);
        CleanupModels.CleanupResult result = stagingCleanupService.runCleanup(limits.maxAgeHours(), limits.maxSizeMb());
        return ResponseEntity.ok(new CleanupModels.RunResponse(
                true,
                result,
                "Cleaned up %d files, freed %s MB".formatted(result.totalDeleted(), result.totalFreedMb())
        ));
    }

    @DeleteMapping("/all")
    public ResponseEntity<CleanupModels.ClearAllResponse> clearAll() {
        return ResponseEntity.ok(stagingCleanupService.clearAll());
    }

    private CleanupModels.Limits limitsOf(CleanupModels.CleanupRequest request) {
        Double maxAge = request == null ? null : request.maxAgeHours();
        Double maxSize = request == null ? null : request.maxSizeMb();
        return new CleanupModels.Limits(
                maxAge == null || maxAge <= 0 ? cleanupProperties.getMaxAgeHours() : maxAge,
                maxSize == null || maxSize <= 0 ? cleanupProperties.getMaxSizeMb() : maxSize
        );
    }
}
