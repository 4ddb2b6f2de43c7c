package com.bcnjobs.tracker.scrape.model;

import java.util.List;
import java.util.Map;

public record SourceFetchResult(
    SourceStatus status,
    List<JobRecord> records,
    int scannedCount,
    Map<String, Integer> errors,
    String message
) {
    public SourceFetchResult {
        records = records == null ? List.of() : List.copyOf(records);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public static SourceFetchResult success(List<JobRecord> records, int scannedCount, Map<String, Integer> errors) {
        return new SourceFetchResult(SourceStatus.SUCCESS, records, scannedCount, errors, null);
    }

    public static SourceFetchResult failed(Map<String, Integer> errors, String message) {
        return new SourceFetchResult(SourceStatus.FAILED, List.of(), 0, errors, message);
    }

    public static SourceFetchResult skipped(String message) {
        return new SourceFetchResult(SourceStatus.SKIPPED, List.of(), 0, Map.of(), message);
    }
}
