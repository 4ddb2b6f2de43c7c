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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LeverSourceAdapter extends AbstractHttpSourceAdapter {
    static final String API_BASE = "https://api.lever.co/v0/postings/";

    public LeverSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.LEVER;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String account = identifier(company);
        if (account == null) {
            return SourceFetchResult.skipped("lever account missing");
        }
        Map<String, Integer> errors = new LinkedHashMap<>();
        String feedUrl = API_BASE + account + "?mode=json";
        HttpFetchResult fetch = httpClient.get(feedUrl, JSON_ACCEPT);
        if (!fetch.hasBody()) {
            return fetchFailed(company, errors, fetch);
        }

        try {
            JsonNode root = objectMapper.readTree(fetch.body());
            if (!root.isArray()) {
                increment(errors, "lever_invalid_payload");
                return SourceFetchResult.failed(errors, "lever_invalid_payload");
            }
            List<JobRecord> records = new ArrayList<>();
            int scanned = 0;
            for (JsonNode job : root) {
                scanned++;
                accept(toPosting(company, job), records);
            }
            return finish(company, records, scanned, errors);
        } catch (Exception e) {
            return parseFailed(company, errors, e);
        }
    }

    RawPosting toPosting(CompanyEntry company, JsonNode job) {
        String url = firstNonBlank(
            JobUrlUtils.sanitizeCanonicalUrl(text(job, "hostedUrl")),
            JobUrlUtils.sanitizeCanonicalUrl(text(job, "applyUrl"))
        );
        LocalDate postedDate = null;
        JsonNode createdAt = job.get("createdAt");
        if (createdAt != null && createdAt.canConvertToLong()) {
            postedDate = PostingDates.fromEpochMillis(createdAt.asLong());
        }
        JsonNode categories = job.path("categories");
        return new RawPosting(
            company.id(),
            text(job, "text"),
            url,
            text(categories, "location"),
            firstNonBlank(text(categories, "team"), text(categories, "department")),
            postedDate,
            firstNonBlank(text(job, "descriptionPlain"), htmlToText(text(job, "description")))
        );
    }
}
