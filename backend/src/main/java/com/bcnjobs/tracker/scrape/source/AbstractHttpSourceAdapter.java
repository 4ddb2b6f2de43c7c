package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.classify.JobClassifier;
import com.bcnjobs.tracker.scrape.http.PoliteHttpClient;
import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.HttpFetchResult;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.RawPosting;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared plumbing for adapters that read a source over HTTP.
 */
public abstract class AbstractHttpSourceAdapter implements SourceAdapter {
    protected static final String JSON_ACCEPT = "application/json,*/*;q=0.8";
    protected static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final PoliteHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final TrackerProperties properties;

    protected AbstractHttpSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    protected String errorPrefix() {
        return family().name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies the posting and adds it to {@code out} when it is forwarded.
     */
    protected void accept(RawPosting posting, List<JobRecord> out) {
        accept(posting, null, out);
    }

    /**
     * Same as {@link #accept(RawPosting, List)}, classifying a location-less posting as if it were
     * listed at {@code fallbackLocation}.
     */
    protected void accept(RawPosting posting, String fallbackLocation, List<JobRecord> out) {
        JobRecord candidate = JobRecordFactory.toCandidate(posting, family().isStructuredApi(), fallbackLocation);
        if (candidate != null) {
            out.add(candidate);
        } else if (posting != null) {
            log.debug("Skipping posting '{}' at {}", posting.title(), posting.url());
        }
    }

    /**
     * Whether a listed posting could still be forwarded once its description is known. Either the
     * title names a target role or the listing already places it in the target location.
     */
    protected boolean mayMatchWithDetail(RawPosting listed) {
        return JobClassifier.isTargetRole(listed.title(), null)
            || JobClassifier.isTargetLocation(listed.location(), listed.title(), null);
    }

    protected SourceFetchResult fetchFailed(CompanyEntry company, Map<String, Integer> errors, HttpFetchResult fetch) {
        String status = adapterFetchStatus(errorPrefix(), fetch);
        increment(errors, status);
        log.warn("{} fetch failed for {}: {}", family(), company.id(), status);
        return SourceFetchResult.failed(errors, status);
    }

    protected SourceFetchResult parseFailed(CompanyEntry company, Map<String, Integer> errors, Exception e) {
        String status = errorPrefix() + "_parse_error";
        increment(errors, status);
        log.warn("Failed to parse {} payload for {}", family(), company.id(), e);
        return SourceFetchResult.failed(errors, status);
    }

    protected SourceFetchResult finish(CompanyEntry company, List<JobRecord> records, int scanned, Map<String, Integer> errors) {
        log.info("{} [{}]: found {} matching jobs from {} total", family(), company.id(), records.size(), scanned);
        return SourceFetchResult.success(records, scanned, errors);
    }

    protected String identifier(CompanyEntry company) {
        return company.hasSourceIdentifier() ? company.sourceIdentifier().trim() : null;
    }

    protected String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String raw = value.asText();
            return raw.isBlank() ? null : raw;
        }
        return value.toString();
    }

    protected String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        return Jsoup.parse(html).text();
    }

    protected String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    protected void increment(Map<String, Integer> errors, String key) {
        errors.put(key, errors.getOrDefault(key, 0) + 1);
    }

    protected String adapterFetchStatus(String prefix, HttpFetchResult fetch) {
        if (fetch == null) {
            return prefix + "_unknown_error";
        }
        if (fetch.errorCode() != null && !fetch.errorCode().isBlank()) {
            return prefix + "_" + fetch.errorCode();
        }
        if (fetch.statusCode() > 0 && !fetch.isSuccessful()) {
            return prefix + "_http_" + fetch.statusCode();
        }
        if (fetch.isSuccessful()) {
            return prefix + "_empty_body";
        }
        return prefix + "_unknown_error";
    }
}
