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
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Workable public job board. The listing is paged with an opaque {@code nextPage} token and carries
 * no description, so one detail request is issued per posting that could still match.
 */
@Component
public class WorkableSourceAdapter extends AbstractHttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(WorkableSourceAdapter.class);
    static final String API_BASE = "https://apply.workable.com/api/v3/accounts/";

    public WorkableSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.WORKABLE;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String subdomain = identifier(company);
        if (subdomain == null) {
            return SourceFetchResult.skipped("workable subdomain missing");
        }
        Map<String, Integer> errors = new LinkedHashMap<>();
        String listUrl = API_BASE + subdomain + "/jobs";
        List<JobRecord> records = new ArrayList<>();
        int scanned = 0;
        int detailBudget = properties.getLimits().getMaxDetailRequests();
        String nextPage = null;
        boolean morePages = false;

        for (int page = 0; page < properties.getLimits().getMaxPages(); page++) {
            morePages = false;
            HttpFetchResult fetch = httpClient.postJson(listUrl, pageRequest(nextPage), JSON_ACCEPT);
            if (!fetch.hasBody()) {
                if (page == 0) {
                    return fetchFailed(company, errors, fetch);
                }
                increment(errors, adapterFetchStatus("workable", fetch));
                break;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(fetch.body());
            } catch (Exception e) {
                if (page == 0) {
                    return parseFailed(company, errors, e);
                }
                increment(errors, "workable_parse_error");
                break;
            }
            JsonNode results = root.path("results");
            if (!results.isArray()) {
                if (page == 0) {
                    increment(errors, "workable_invalid_payload");
                    return SourceFetchResult.failed(errors, "workable_invalid_payload");
                }
                break;
            }
            for (JsonNode job : results) {
                scanned++;
                RawPosting listed = toPosting(company, subdomain, job, null);
                String description = null;
                if (detailBudget > 0 && mayMatchWithDetail(listed)) {
                    detailBudget--;
                    description = fetchDescription(subdomain, text(job, "shortcode"), errors);
                }
                accept(description == null ? listed : toPosting(company, subdomain, job, description), records);
            }
            nextPage = text(root, "nextPage");
            morePages = nextPage != null && !results.isEmpty();
            if (!morePages) {
                break;
            }
        }
        if (morePages) {
            increment(errors, "workable_page_cap_reached");
        }
        return finish(company, records, scanned, errors);
    }

    RawPosting toPosting(CompanyEntry company, String subdomain, JsonNode job, String description) {
        String shortcode = text(job, "shortcode");
        String url = shortcode == null
            ? null
            : JobUrlUtils.sanitizeCanonicalUrl("https://apply.workable.com/" + subdomain + "/j/" + shortcode + "/");
        return new RawPosting(
            company.id(),
            text(job, "title"),
            url,
            location(job),
            department(job.get("department")),
            PostingDates.parseIsoDate(firstNonBlank(text(job, "published"), text(job, "published_on"))),
            description
        );
    }

    private String fetchDescription(String subdomain, String shortcode, Map<String, Integer> errors) {
        if (shortcode == null) {
            return null;
        }
        HttpFetchResult detail = httpClient.postJson(API_BASE + subdomain + "/jobs/" + shortcode, "{}", JSON_ACCEPT);
        if (!detail.hasBody()) {
            increment(errors, adapterFetchStatus("workable_detail", detail));
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(detail.body());
            List<String> parts = new ArrayList<>();
            for (String field : List.of("description", "requirements", "benefits")) {
                String value = htmlToText(text(root, field));
                if (value != null && !value.isBlank()) {
                    parts.add(value);
                }
            }
            return parts.isEmpty() ? null : String.join(" ", parts);
        } catch (Exception e) {
            log.debug("Failed to parse Workable detail for {}/{}", subdomain, shortcode, e);
            increment(errors, "workable_detail_parse_error");
            return null;
        }
    }

    private String pageRequest(String nextPage) {
        ObjectNode request = objectMapper.createObjectNode();
        if (nextPage != null) {
            request.put("token", nextPage);
        }
        return request.toString();
    }

    private String location(JsonNode job) {
        JsonNode location = job.get("location");
        String base;
        if (location != null && location.isObject()) {
            List<String> parts = new ArrayList<>();
            for (String field : List.of("city", "region", "country")) {
                String value = text(location, field);
                if (value != null && !parts.contains(value.trim())) {
                    parts.add(value.trim());
                }
            }
            base = parts.isEmpty() ? null : String.join(", ", parts);
        } else {
            base = text(job, "location");
        }
        String workplace = text(job, "workplace");
        if (workplace == null || workplace.equalsIgnoreCase("on_site")) {
            return base;
        }
        String label = workplace.toLowerCase(Locale.ROOT).contains("hybrid") ? "Hybrid" : "Remote";
        return base == null ? label : base + " (" + label + ")";
    }

    private String department(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode value : node) {
                if (value.isTextual() && !value.asText().isBlank()) {
                    values.add(value.asText().trim());
                }
            }
            return values.isEmpty() ? null : String.join(", ", values);
        }
        return node.isTextual() ? node.asText() : null;
    }
}
