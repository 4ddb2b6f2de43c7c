package com.bcnjobs.tracker.scrape.model;

import java.time.Instant;
import java.util.List;

public record ScrapeRunSummary(
    Instant startedAt,
    Instant finishedAt,
    int configuredCount,
    int attemptedCount,
    int succeededCount,
    int failedCount,
    int skippedCount,
    int totalNew,
    boolean highFailureRate,
    List<SourceRunResult> sources
) {
}
