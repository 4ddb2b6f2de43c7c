package com.bcnjobs.tracker.scrape.model;

/**
 * Read-side sponsorship hint combining posting signals with company metadata.
 */
public enum VisaStatus {
    CONFIRMED,
    POSSIBLE,
    LIKELY,
    UNKNOWN;

    public static VisaStatus derive(JobRecord record, CompanyEntry company) {
        if (record != null && record.mentionsVisaSupport()) {
            return CONFIRMED;
        }
        if (record != null && record.mentionsRelocation()) {
            return POSSIBLE;
        }
        if (company != null && company.knownVisaSponsor()) {
            return LIKELY;
        }
        return UNKNOWN;
    }
}
