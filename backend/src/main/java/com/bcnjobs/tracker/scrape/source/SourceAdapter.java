package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;

/**
 * Fetches one company's postings from a single kind of feed and returns the candidates that pass
 * classification.
 *
 * <p>Implementations never throw for remote failures: an unreachable or malformed source yields a
 * {@link com.bcnjobs.tracker.scrape.model.SourceStatus#FAILED} result, and a configuration gap
 * yields {@link com.bcnjobs.tracker.scrape.model.SourceStatus#SKIPPED}. Every returned record has a
 * company id, a non-blank title and a non-blank URL.
 */
public interface SourceAdapter {

    SourceFamily family();

    SourceFetchResult fetch(CompanyEntry company);
}
