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
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class GreenhouseSourceAdapter extends AbstractHttpSourceAdapter {
    static final String API_BASE = "https://boards-api.greenhouse.io/v1/boards/";

    public GreenhouseSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.GREENHOUSE;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String token = identifier(company);
        if (token == null) {
            return SourceFetchResult.skipped("greenhouse board token missing");
        }
        Map<String, Integer> errors = new LinkedHashMap<>();
        String feedUrl = API_BASE + token + "/jobs?content=true";
        HttpFetchResult fetch = httpClient.get(feedUrl, JSON_ACCEPT);
        if (!fetch.hasBody()) {
            return fetchFailed(company, errors, fetch);
        }

        try {
            JsonNode jobs = objectMapper.readTree(fetch.body()).path("jobs");
            if (!jobs.isArray()) {
                increment(errors, "greenhouse_invalid_payload");
                return SourceFetchResult.failed(errors, "greenhouse_invalid_payload");
            }
            List<JobRecord> records = new ArrayList<>();
            int scanned = 0;
            for (JsonNode job : jobs) {
                scanned++;
                accept(toPosting(company, token, job), records);
            }
            return finish(company, records, scanned, errors);
        } catch (Exception e) {
            return parseFailed(company, errors, e);
        }
    }

    RawPosting toPosting(CompanyEntry company, String token, JsonNode job) {
        String rawHtml = text(job, "content");
        String description = rawHtml == null ? null : htmlToText(Parser.unescapeEntities(rawHtml, false));
        String identifier = text(job, "id");
        String derivedUrl = identifier == null ? null : "https://boards.greenhouse.io/" + token + "/jobs/" + identifier;
        String url = firstNonBlank(
            JobUrlUtils.sanitizeCanonicalUrl(text(job, "absolute_url")),
            JobUrlUtils.sanitizeCanonicalUrl(derivedUrl)
        );
        String department = null;
        JsonNode departments = job.path("departments");
        if (departments.isArray() && departments.size() > 0) {
            department = text(departments.get(0), "name");
        }
        return new RawPosting(
            company.id(),
            text(job, "title"),
            url,
            text(job.path("location"), "name"),
            department,
            PostingDates.parseIsoDate(firstNonBlank(text(job, "updated_at"), text(job, "first_published"))),
            description
        );
    }
}
