package com.bcnjobs.tracker.scrape.model;

import java.util.Map;

public record SourceRunResult(
    String companyId,
    SourceFamily sourceFamily,
    SourceStatus status,
    int scannedCount,
    int matchedCount,
    int newCount,
    int duplicateCount,
    Map<String, Integer> errors,
    String message
) {
    public static SourceRunResult skipped(CompanyEntry company, String message) {
        return new SourceRunResult(company.id(), company.sourceFamily(), SourceStatus.SKIPPED, 0, 0, 0, 0, Map.of(), message);
    }

    public static SourceRunResult failed(CompanyEntry company, Map<String, Integer> errors, String message) {
        return new SourceRunResult(company.id(), company.sourceFamily(), SourceStatus.FAILED, 0, 0, 0, 0, errors, message);
    }
}
