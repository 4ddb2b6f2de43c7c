package com.bcnjobs.tracker.scrape.model;

import java.time.LocalDate;

/**
 * Posting as mapped from a source payload, before validation and classification.
 */
public record RawPosting(
    String companyId,
    String title,
    String url,
    String location,
    String department,
    LocalDate postedDate,
    String description
) {
}
