package com.careinsight.careinsight.cleanup;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class CleanupModels {

    private CleanupModels() {
    }

    public record CleanupStats(
            int totalFiles,
            double totalSizeMb,
            double oldestFileAgeHours,
            @JsonProperty("files_over_24h") int filesOver24h,
            @JsonProperty("files_over_7d") int filesOver7d
    ) {
    }

    public record AgeCleanupResult(int filesDeleted, int filesKept, double spaceFreedMb) {
    }

    public record SizeCleanupResult(int filesDeleted, double spaceFreedMb) {
    }

    public record CleanupRequest(Double maxAgeHours, Double maxSizeMb, Boolean dryRun) {
    }

    public record StatsResponse(boolean ok, CleanupStats stats, String directory) {
    }

    public record WouldDelete(int byAge, int bySize, int total) {
    }

    public record Limits(double maxAgeHours, double maxSizeMb) {
    }

    public record PreviewResponse(
            boolean ok,
            boolean preview,
            CleanupStats currentStats,
            WouldDelete wouldDelete,
            double wouldFreeMb,
            int wouldKeep,
            Limits config
    ) {
    }

    public record CleanupResult(
            String timestamp,
            CleanupStats before,
            CleanupStats after,
            AgeCleanupResult ageCleanup,
            SizeCleanupResult sizeCleanup,
            int totalDeleted,
            double totalFreedMb
    ) {
    }

    public record RunResponse(boolean ok, CleanupResult result, String message) {
    }

    public record ClearAllResponse(boolean ok, int deleted, double freedMb, String warning) {
    }
}
