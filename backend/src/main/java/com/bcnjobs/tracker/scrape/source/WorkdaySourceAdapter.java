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
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Workday career sites through the CXS job search endpoint. Only the list view is read, so records
 * carry no description.
 */
@Component
public class WorkdaySourceAdapter extends AbstractHttpSourceAdapter {
    static final int PAGE_SIZE = 20;

    private final Clock clock;

    public WorkdaySourceAdapter(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        TrackerProperties properties,
        Clock clock
    ) {
        super(httpClient, objectMapper, properties);
        this.clock = clock;
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.WORKDAY;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String careersUrl = identifier(company);
        if (careersUrl == null) {
            return SourceFetchResult.skipped("workday careers url missing");
        }
        Map<String, Integer> errors = new LinkedHashMap<>();
        WorkdayEndpoint endpoint = deriveWorkdayEndpoint(careersUrl);
        if (endpoint == null) {
            increment(errors, "workday_endpoint_parse_failed");
            return SourceFetchResult.failed(errors, "workday_endpoint_parse_failed");
        }

        String cxsUrl = "https://" + endpoint.host() + "/wday/cxs/" + endpoint.tenant() + "/" + endpoint.site() + "/jobs";
        LocalDate today = LocalDate.now(clock);
        List<JobRecord> records = new ArrayList<>();
        int scanned = 0;
        int offset = 0;
        Integer total = null;
        for (int page = 0; page < properties.getLimits().getMaxPages(); page++) {
            HttpFetchResult fetch = httpClient.postJson(cxsUrl, pageRequest(offset), JSON_ACCEPT);
            if (!fetch.hasBody()) {
                if (page == 0) {
                    return fetchFailed(company, errors, fetch);
                }
                increment(errors, adapterFetchStatus("workday", fetch));
                break;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(fetch.body());
            } catch (Exception e) {
                if (page == 0) {
                    return parseFailed(company, errors, e);
                }
                increment(errors, "workday_parse_error");
                break;
            }
            JsonNode jobs = root.path("jobPostings");
            if (!jobs.isArray() || jobs.isEmpty()) {
                break;
            }
            // only the first page reports an accurate total
            if (total == null) {
                JsonNode totalNode = root.get("total");
                total = totalNode != null && totalNode.canConvertToInt() ? totalNode.asInt() : Integer.MAX_VALUE;
            }
            for (JsonNode job : jobs) {
                scanned++;
                RawPosting posting = toPosting(company, endpoint, job, today);
                if (posting.url() == null) {
                    increment(errors, "workday_missing_canonical_url");
                    continue;
                }
                accept(posting, records);
            }
            offset += jobs.size();
            if (offset >= total || jobs.size() < PAGE_SIZE) {
                break;
            }
        }
        return finish(company, records, scanned, errors);
    }

    RawPosting toPosting(CompanyEntry company, WorkdayEndpoint endpoint, JsonNode job, LocalDate today) {
        String externalPath = firstNonBlank(text(job, "externalPath"), text(job, "externalUrl"));
        return new RawPosting(
            company.id(),
            firstNonBlank(text(job, "title"), text(job, "jobTitle")),
            JobUrlUtils.sanitizeCanonicalUrl(toCanonicalWorkdayUrl(endpoint.host(), endpoint.site(), externalPath)),
            extractWorkdayLocation(job),
            null,
            PostingDates.parseRelative(text(job, "postedOn"), today),
            null
        );
    }

    private String pageRequest(int offset) {
        ObjectNode request = objectMapper.createObjectNode();
        request.set("appliedFacets", objectMapper.createObjectNode());
        request.put("limit", PAGE_SIZE);
        request.put("offset", offset);
        request.put("searchText", "");
        return request.toString();
    }

    WorkdayEndpoint deriveWorkdayEndpoint(String careersUrl) {
        URI uri = JobUrlUtils.safeUri(careersUrl.startsWith("http") ? careersUrl : "https://" + careersUrl);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (!host.contains("myworkdayjobs.com")) {
            return null;
        }
        String[] hostParts = host.split("\\.");
        if (hostParts.length < 3 || hostParts[0].isBlank()) {
            return null;
        }
        String tenant = hostParts[0];

        List<String> segments = pathSegments(uri.getPath());
        String site = null;
        if (segments.size() >= 4 && "wday".equals(segments.get(0)) && "cxs".equals(segments.get(1))) {
            site = segments.get(3);
        } else if (segments.size() >= 2 && isLocaleSegment(segments.get(0))) {
            site = segments.get(1);
        } else if (!segments.isEmpty() && !isLocaleSegment(segments.get(0))) {
            site = segments.get(0);
        }
        if (site == null || site.isBlank()) {
            return null;
        }
        return new WorkdayEndpoint(host, tenant, site);
    }

    String toCanonicalWorkdayUrl(String host, String site, String externalPath) {
        if (externalPath == null || externalPath.isBlank()) {
            return null;
        }
        String trimmed = externalPath.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            URI uri = JobUrlUtils.safeUri(trimmed);
            if (uri == null || uri.getHost() == null || !uri.getHost().toLowerCase(Locale.ROOT).endsWith("myworkdayjobs.com")) {
                return null;
            }
            return trimmed;
        }
        List<String> candidates = buildWorkdayPathCandidates(JobUrlUtils.stripQueryAndFragment(trimmed), site);
        return candidates.isEmpty() ? null : "https://" + host + candidates.get(0);
    }

    private List<String> buildWorkdayPathCandidates(String rawPath, String site) {
        if (rawPath == null || rawPath.isBlank()) {
            return List.of();
        }
        String path = rawPath.startsWith("/") ? rawPath : "/" + rawPath;
        LinkedHashSet<String> candidates = new LinkedHashSet<>();
        boolean hasLocale = path.matches("^/[a-z]{2}-[A-Z]{2}/.*");
        boolean startsWithSite = site != null
            && path.toLowerCase(Locale.ROOT).startsWith("/" + site.toLowerCase(Locale.ROOT) + "/");
        if (hasLocale) {
            candidates.add(path);
        } else {
            String sitePrefixed = startsWithSite ? path : "/" + site + path;
            candidates.add("/en-US" + sitePrefixed);
            candidates.add(sitePrefixed);
        }
        return new ArrayList<>(candidates);
    }

    private String extractWorkdayLocation(JsonNode job) {
        String direct = firstNonBlank(text(job, "locationsText"), text(job, "location"));
        if (direct != null) {
            return direct;
        }
        JsonNode bulletFields = job.get("bulletFields");
        if (bulletFields != null && bulletFields.isArray() && bulletFields.size() > 0) {
            List<String> values = new ArrayList<>();
            for (int i = 0; i < Math.min(2, bulletFields.size()); i++) {
                String value = bulletFields.get(i).asText(null);
                if (value != null && !value.isBlank()) {
                    values.add(value.trim());
                }
            }
            return values.isEmpty() ? null : String.join(", ", values);
        }
        return null;
    }

    private boolean isLocaleSegment(String segment) {
        return segment != null && segment.matches("^[a-z]{2}-[A-Z]{2}$");
    }

    private List<String> pathSegments(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : rawPath.split("/")) {
            if (part != null && !part.isBlank()) {
                out.add(part);
            }
        }
        return out;
    }

    record WorkdayEndpoint(String host, String tenant, String site) {
    }
}
