package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.http.PoliteHttpClient;
import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.HttpFetchResult;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.RawPosting;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.bcnjobs.tracker.scrape.util.JobUrlUtils;
import com.bcnjobs.tracker.scrape.util.PostingDates;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class AshbySourceAdapter extends AbstractHttpSourceAdapter {
    static final String API_BASE = "https://api.ashbyhq.com/posting-api/job-board/";

    public AshbySourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.ASHBY;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String org = identifier(company);
        if (org == null) {
            return SourceFetchResult.skipped("ashby organization missing");
        }
        Map<String, Integer> errors = new LinkedHashMap<>();
        HttpFetchResult fetch = httpClient.get(API_BASE + org, JSON_ACCEPT);
        if (!fetch.hasBody()) {
            return fetchFailed(company, errors, fetch);
        }

        try {
            JsonNode jobs = objectMapper.readTree(fetch.body()).path("jobs");
            if (!jobs.isArray()) {
                increment(errors, "ashby_invalid_payload");
                return SourceFetchResult.failed(errors, "ashby_invalid_payload");
            }
            List<JobRecord> records = new ArrayList<>();
            int scanned = 0;
            for (JsonNode job : jobs) {
                scanned++;
                accept(toPosting(company, org, job), records);
            }
            return finish(company, records, scanned, errors);
        } catch (Exception e) {
            return parseFailed(company, errors, e);
        }
    }

    RawPosting toPosting(CompanyEntry company, String org, JsonNode job) {
        String id = text(job, "id");
        String constructed = id == null ? null : "https://jobs.ashbyhq.com/" + org + "/" + id;
        String url = firstNonBlank(
            JobUrlUtils.sanitizeCanonicalUrl(text(job, "jobUrl")),
            JobUrlUtils.sanitizeCanonicalUrl(constructed)
        );
        return new RawPosting(
            company.id(),
            text(job, "title"),
            url,
            location(job),
            firstNonBlank(text(job, "department"), text(job, "team")),
            PostingDates.parseIsoDate(text(job, "publishedAt")),
            firstNonBlank(text(job, "descriptionPlain"), htmlToText(text(job, "descriptionHtml")), htmlToText(text(job, "description")))
        );
    }

    private String location(JsonNode job) {
        Set<String> parts = new LinkedHashSet<>();
        String primary = text(job, "location");
        if (primary != null) {
            parts.add(primary.trim());
        }
        JsonNode secondary = job.path("secondaryLocations");
        if (secondary.isArray()) {
            for (JsonNode node : secondary) {
                String value = text(node, "location");
                if (value != null) {
                    parts.add(value.trim());
                }
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        String joined = String.join(" | ", parts);
        JsonNode remote = job.get("isRemote");
        if (remote != null && remote.asBoolean(false) && !joined.toLowerCase(Locale.ROOT).contains("remote")) {
            joined = joined + " (Remote)";
        }
        return joined;
    }
}
