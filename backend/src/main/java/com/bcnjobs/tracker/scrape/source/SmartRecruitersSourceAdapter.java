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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SmartRecruiters public postings API: offset paging up to {@code totalFound}, then one detail
 * request per posting that could still match, for the job ad sections.
 */
@Component
public class SmartRecruitersSourceAdapter extends AbstractHttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(SmartRecruitersSourceAdapter.class);
    static final String API_BASE = "https://api.smartrecruiters.com/v1/companies/";
    static final int PAGE_SIZE = 100;
    private static final List<String> SECTIONS = List.of("jobDescription", "qualifications", "additionalInformation");

    public SmartRecruitersSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.SMARTRECRUITERS;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String srCompany = identifier(company);
        if (srCompany == null) {
            return SourceFetchResult.skipped("smartrecruiters company missing");
        }
        Map<String, Integer> errors = new LinkedHashMap<>();
        List<JobRecord> records = new ArrayList<>();
        int scanned = 0;
        int detailBudget = properties.getLimits().getMaxDetailRequests();
        int offset = 0;
        Integer total = null;

        for (int page = 0; page < properties.getLimits().getMaxPages(); page++) {
            String listUrl = API_BASE + srCompany + "/postings?offset=" + offset + "&limit=" + PAGE_SIZE;
            HttpFetchResult fetch = httpClient.get(listUrl, JSON_ACCEPT);
            if (!fetch.hasBody()) {
                if (page == 0) {
                    return fetchFailed(company, errors, fetch);
                }
                increment(errors, adapterFetchStatus("smartrecruiters", fetch));
                break;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(fetch.body());
            } catch (Exception e) {
                if (page == 0) {
                    return parseFailed(company, errors, e);
                }
                increment(errors, "smartrecruiters_parse_error");
                break;
            }
            JsonNode content = root.path("content");
            if (!content.isArray()) {
                if (page == 0) {
                    increment(errors, "smartrecruiters_invalid_payload");
                    return SourceFetchResult.failed(errors, "smartrecruiters_invalid_payload");
                }
                break;
            }
            if (total == null) {
                JsonNode totalNode = root.get("totalFound");
                total = totalNode != null && totalNode.canConvertToInt() ? totalNode.asInt() : content.size();
            }
            for (JsonNode job : content) {
                scanned++;
                RawPosting listed = toPosting(company, srCompany, job, null);
                String description = null;
                if (detailBudget > 0 && mayMatchWithDetail(listed)) {
                    detailBudget--;
                    description = fetchDescription(srCompany, text(job, "id"), errors);
                }
                accept(description == null ? listed : toPosting(company, srCompany, job, description), records);
            }
            offset += content.size();
            if (content.isEmpty() || offset >= total) {
                break;
            }
        }
        if (total != null && offset < total) {
            increment(errors, "smartrecruiters_page_cap_reached");
        }
        return finish(company, records, scanned, errors);
    }

    RawPosting toPosting(CompanyEntry company, String srCompany, JsonNode job, String description) {
        String id = text(job, "id");
        String url = id == null ? null : JobUrlUtils.sanitizeCanonicalUrl("https://jobs.smartrecruiters.com/" + srCompany + "/" + id);
        JsonNode location = job.path("location");
        String city = text(location, "city");
        String country = text(location, "country");
        String place = firstNonBlank(text(location, "fullLocation"), joinNonBlank(city, country));
        JsonNode remote = location.get("remote");
        if (place != null && remote != null && remote.asBoolean(false)) {
            place = place + " (Remote)";
        }
        return new RawPosting(
            company.id(),
            text(job, "name"),
            url,
            place,
            text(job.path("department"), "label"),
            PostingDates.parseIsoDate(text(job, "releasedDate")),
            description
        );
    }

    private String fetchDescription(String srCompany, String id, Map<String, Integer> errors) {
        if (id == null) {
            return null;
        }
        HttpFetchResult detail = httpClient.get(API_BASE + srCompany + "/postings/" + id, JSON_ACCEPT);
        if (!detail.hasBody()) {
            increment(errors, adapterFetchStatus("smartrecruiters_detail", detail));
            return null;
        }
        try {
            JsonNode sections = objectMapper.readTree(detail.body()).path("jobAd").path("sections");
            List<String> parts = new ArrayList<>();
            for (String section : SECTIONS) {
                String value = htmlToText(text(sections.path(section), "text"));
                if (value != null && !value.isBlank()) {
                    parts.add(value);
                }
            }
            return parts.isEmpty() ? null : String.join(" ", parts);
        } catch (Exception e) {
            log.debug("Failed to parse SmartRecruiters detail for {}/{}", srCompany, id, e);
            increment(errors, "smartrecruiters_detail_parse_error");
            return null;
        }
    }

    private String joinNonBlank(String first, String second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first + ", " + second;
    }
}
