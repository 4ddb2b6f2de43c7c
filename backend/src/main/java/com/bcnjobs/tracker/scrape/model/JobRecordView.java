package com.bcnjobs.tracker.scrape.model;

import java.time.Instant;
import java.time.LocalDate;

public record JobRecordView(
    String identityKey,
    String companyId,
    String companyName,
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
    boolean coreRole,
    VisaStatus visaStatus
) {
    public static JobRecordView of(JobRecord record, CompanyEntry company) {
        return new JobRecordView(
            record.identityKey(),
            record.companyId(),
            company == null ? record.companyId() : company.displayName(),
            record.title(),
            record.url(),
            record.location(),
            record.department(),
            record.postedDate(),
            record.description(),
            record.discoveredAt(),
            record.targetLocation(),
            record.targetRole(),
            record.mentionsVisaSupport(),
            record.mentionsRelocation(),
            record.workType(),
            record.coreRole(),
            VisaStatus.derive(record, company)
        );
    }
}
