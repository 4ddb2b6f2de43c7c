package com.bcnjobs.tracker.scrape.model;

import com.bcnjobs.tracker.scrape.util.JobIdentity;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Canonical posting. {@code discoveredAt} is null until the store assigns it.
 */
public record JobRecord(
    String companyId,
    String title,
    String url,
    String location,
    String department,
    LocalDate postedDate,
    String description,
    Instant discoveredAt,
    boolean targetLocation,
    boolean targetRole,
    boolean mentionsVisaSupport,
    boolean mentionsRelocation,
    WorkType workType,
    boolean coreRole
) {
    public static JobRecord candidate(RawPosting posting, JobClassification classification) {
        return new JobRecord(
            posting.companyId(),
            posting.title(),
            posting.url(),
            posting.location(),
            posting.department(),
            posting.postedDate(),
            posting.description() == null ? "" : posting.description(),
            null,
            classification.targetLocation(),
            classification.targetRole(),
            classification.mentionsVisaSupport(),
            classification.mentionsRelocation(),
            classification.workType(),
            classification.coreRole()
        );
    }

    public String identityKey() {
        return JobIdentity.identityKey(companyId, url);
    }
}
