package com.bcnjobs.tracker.scrape.model;

public record JobClassification(
    boolean targetLocation,
    boolean targetRole,
    boolean mentionsVisaSupport,
    boolean mentionsRelocation,
    WorkType workType,
    boolean coreRole
) {
    public boolean isForwarded() {
        return targetLocation && targetRole;
    }
}
