package com.careinsight.careinsight.data;

public record DataStatsResponse(long totalRows, long uniquePersons) {
}
