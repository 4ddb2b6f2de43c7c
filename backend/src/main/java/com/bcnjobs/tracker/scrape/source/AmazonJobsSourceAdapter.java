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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * amazon.jobs search feed filtered to one Spanish city. The registry identifier, when present,
 * overrides the configured target city.
 */
@Component
public class AmazonJobsSourceAdapter extends AbstractHttpSourceAdapter {
    static final String SEARCH_URL = "https://www.amazon.jobs/en/search.json";
    static final String SITE_BASE = "https://www.amazon.jobs";
    static final int PAGE_SIZE = 100;

    public AmazonJobsSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.AMAZON;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String city = firstNonBlank(identifier(company), properties.getTarget().getCity());
        Map<String, Integer> errors = new LinkedHashMap<>();
        List<JobRecord> records = new ArrayList<>();
        int scanned = 0;
        int offset = 0;
        Integer hits = null;

        for (int page = 0; page < properties.getLimits().getMaxPages(); page++) {
            HttpFetchResult fetch = httpClient.get(searchUrl(city, offset), JSON_ACCEPT);
            if (!fetch.hasBody()) {
                if (page == 0) {
                    return fetchFailed(company, errors, fetch);
                }
                increment(errors, adapterFetchStatus("amazon", fetch));
                break;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(fetch.body());
            } catch (Exception e) {
                if (page == 0) {
                    return parseFailed(company, errors, e);
                }
                increment(errors, "amazon_parse_error");
                break;
            }
            JsonNode jobs = root.path("jobs");
            if (!jobs.isArray()) {
                if (page == 0) {
                    increment(errors, "amazon_invalid_payload");
                    return SourceFetchResult.failed(errors, "amazon_invalid_payload");
                }
                break;
            }
            if (hits == null) {
                JsonNode hitsNode = root.get("hits");
                hits = hitsNode != null && hitsNode.canConvertToInt() ? hitsNode.asInt() : jobs.size();
            }
            for (JsonNode job : jobs) {
                scanned++;
                accept(toPosting(company, job), records);
            }
            offset += jobs.size();
            if (jobs.isEmpty() || offset >= hits) {
                break;
            }
        }
        if (hits != null && offset < hits) {
            increment(errors, "amazon_page_cap_reached");
        }
        return finish(company, records, scanned, errors);
    }

    String searchUrl(String city, int offset) {
        return SEARCH_URL
            + "?city=" + URLEncoder.encode(city, StandardCharsets.UTF_8)
            + "&country=ESP"
            + "&offset=" + offset
            + "&result_limit=" + PAGE_SIZE
            + "&sort=recent";
    }

    RawPosting toPosting(CompanyEntry company, JsonNode job) {
        String jobPath = text(job, "job_path");
        String url = jobPath == null ? null : JobUrlUtils.sanitizeCanonicalUrl(JobUrlUtils.absolutize(SITE_BASE + "/", jobPath));
        List<String> parts = new ArrayList<>();
        for (String field : List.of("description_short", "basic_qualifications", "preferred_qualifications")) {
            String value = htmlToText(text(job, field));
            if (value != null && !value.isBlank()) {
                parts.add(value);
            }
        }
        return new RawPosting(
            company.id(),
            text(job, "title"),
            url,
            location(job),
            firstNonBlank(text(job, "job_category"), text(job, "business_category")),
            PostingDates.parseEnglishDate(text(job, "posted_date")),
            String.join("\n\n", parts)
        );
    }

    private String location(JsonNode job) {
        String location = firstNonBlank(text(job, "normalized_location"), text(job, "location"));
        String city = text(job, "city");
        if (location == null) {
            return city;
        }
        if (city != null && !location.toLowerCase(Locale.ROOT).contains(city.toLowerCase(Locale.ROOT))) {
            return location + ", " + city;
        }
        return location;
    }
}
