package com.bcnjobs.tracker.scrape.model;

public record CompanyEntry(
    String id,
    String name,
    SourceFamily sourceFamily,
    String sourceIdentifier,
    boolean knownVisaSponsor,
    String ethicsRating,
    String notes
) {
    public boolean hasSourceIdentifier() {
        return sourceIdentifier != null && !sourceIdentifier.isBlank();
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
