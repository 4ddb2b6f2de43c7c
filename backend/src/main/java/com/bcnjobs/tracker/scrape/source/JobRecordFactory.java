package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.scrape.classify.JobClassifier;
import com.bcnjobs.tracker.scrape.model.JobClassification;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.RawPosting;

/**
 * Turns a mapped posting into a stored-record candidate, or null when it is invalid or out of scope.
 */
public final class JobRecordFactory {
    private JobRecordFactory() {
    }

    public static JobRecord toCandidate(RawPosting posting, boolean applyLanguageGate) {
        return toCandidate(posting, applyLanguageGate, null);
    }

    /**
     * As {@link #toCandidate(RawPosting, boolean)}, classifying with {@code fallbackLocation} when the
     * posting has no location of its own. The fallback is never stored on the record.
     */
    public static JobRecord toCandidate(RawPosting posting, boolean applyLanguageGate, String fallbackLocation) {
        if (posting == null) {
            return null;
        }
        String companyId = trimToNull(posting.companyId());
        String title = trimToNull(posting.title());
        String url = trimToNull(posting.url());
        if (companyId == null || title == null || url == null) {
            return null;
        }
        String description = posting.description() == null ? "" : posting.description().trim();
        if (applyLanguageGate && !JobClassifier.isEnglish(title, description)) {
            return null;
        }
        String location = trimToNull(posting.location());
        String classifiedLocation = location == null ? trimToNull(fallbackLocation) : location;
        JobClassification classification = JobClassifier.classify(title, description, classifiedLocation);
        if (!classification.isForwarded()) {
            return null;
        }
        RawPosting normalized = new RawPosting(
            companyId,
            title,
            url,
            location,
            trimToNull(posting.department()),
            posting.postedDate(),
            description
        );
        return JobRecord.candidate(normalized, classification);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
