package com.bcnjobs.tracker.scrape.model;

import java.util.Locale;

/**
 * Kind of remote feed a company publishes its postings through.
 */
public enum SourceFamily {
    GREENHOUSE(true, true),
    LEVER(true, true),
    ASHBY(true, true),
    WORKABLE(true, true),
    SMARTRECRUITERS(true, true),
    WORKDAY(true, true),
    AMAZON(false, true),
    SUCCESSFACTORS(true, false),
    EMAIL_ALERT(false, false),
    MANUAL(false, false);

    private final boolean requiresIdentifier;
    private final boolean structuredApi;

    SourceFamily(boolean requiresIdentifier, boolean structuredApi) {
        this.requiresIdentifier = requiresIdentifier;
        this.structuredApi = structuredApi;
    }

    public boolean requiresIdentifier() {
        return requiresIdentifier;
    }

    /**
     * Structured-API sources carry full posting text, so the language gate applies to them.
     */
    public boolean isStructuredApi() {
        return structuredApi;
    }

    public static SourceFamily fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "EMAIL", "EMAIL_ALERTS", "MICROSOFT_EMAIL" -> EMAIL_ALERT;
            case "SAP", "TELEFONICA", "SUCCESS_FACTORS" -> SUCCESSFACTORS;
            case "SMART_RECRUITERS" -> SMARTRECRUITERS;
            default -> {
                try {
                    yield SourceFamily.valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    yield null;
                }
            }
        };
    }
}
