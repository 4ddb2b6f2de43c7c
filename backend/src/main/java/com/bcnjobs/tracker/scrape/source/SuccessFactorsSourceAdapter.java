package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.classify.JobClassifier;
import com.bcnjobs.tracker.scrape.http.PoliteHttpClient;
import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.HttpFetchResult;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.RawPosting;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.bcnjobs.tracker.scrape.util.JobUrlUtils;
import com.bcnjobs.tracker.scrape.util.PostingDates;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SAP SuccessFactors career sites (jobs.sap.com, jobs.telefonica.com, ...). The search results page
 * is scraped once per configured term and the union is deduplicated by URL. The registry identifier
 * is the site's base URL. Rows without a location are classified as being in the searched city but
 * stored without one.
 */
@Component
public class SuccessFactorsSourceAdapter extends AbstractHttpSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(SuccessFactorsSourceAdapter.class);
    private static final Pattern JOB_LINK = Pattern.compile("/job/.*?/\\d+/?");

    public SuccessFactorsSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.SUCCESSFACTORS;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        String baseUrl = baseUrl(identifier(company));
        if (baseUrl == null) {
            return SourceFetchResult.skipped("successfactors base url missing");
        }
        String city = properties.getTarget().getCity();
        Map<String, Integer> errors = new LinkedHashMap<>();
        Map<String, SearchRow> rowsByUrl = new LinkedHashMap<>();
        int failedSearches = 0;
        List<String> terms = properties.getSuccessfactors().getSearchTerms();
        for (String term : terms) {
            HttpFetchResult fetch = httpClient.get(searchUrl(baseUrl, term, city), HTML_ACCEPT);
            if (!fetch.hasBody()) {
                failedSearches++;
                increment(errors, adapterFetchStatus("successfactors", fetch));
                continue;
            }
            try {
                for (SearchRow row : parseSearchResults(fetch.body(), baseUrl)) {
                    rowsByUrl.putIfAbsent(row.url(), row);
                }
            } catch (RuntimeException e) {
                failedSearches++;
                log.warn("Failed to parse {} search results for '{}'", baseUrl, term, e);
                increment(errors, "successfactors_parse_error");
            }
        }
        if (!terms.isEmpty() && failedSearches == terms.size()) {
            log.warn("All {} searches failed for {}", failedSearches, company.id());
            return SourceFetchResult.failed(errors, "successfactors_all_searches_failed");
        }

        List<JobRecord> records = new ArrayList<>();
        int detailBudget = properties.getLimits().getMaxDetailRequests();
        for (SearchRow row : rowsByUrl.values()) {
            String classifiedLocation = row.location() == null ? city : row.location();
            String description = null;
            if (detailBudget > 0
                && JobClassifier.isTargetLocation(classifiedLocation, row.title(), null)
                && JobClassifier.isTargetRole(row.title(), null)) {
                detailBudget--;
                description = fetchDescription(row.url(), errors);
            }
            accept(new RawPosting(
                company.id(),
                row.title(),
                row.url(),
                row.location(),
                null,
                PostingDates.parseEnglishDate(row.posted()),
                description
            ), city, records);
        }
        return finish(company, records, rowsByUrl.size(), errors);
    }

    String searchUrl(String baseUrl, String term, String city) {
        return baseUrl + "/search/?q=" + URLEncoder.encode(term, StandardCharsets.UTF_8)
            + "&locationsearch=" + URLEncoder.encode(city, StandardCharsets.UTF_8)
            + "&locale=en_US";
    }

    List<SearchRow> parseSearchResults(String html, String baseUrl) {
        Document document = Jsoup.parse(html, baseUrl);
        List<SearchRow> rows = new ArrayList<>();
        for (Element row : document.select("tr.data-row")) {
            Element titleLink = row.selectFirst("a.jobTitle-link");
            if (titleLink == null) {
                continue;
            }
            SearchRow parsed = toRow(
                titleLink,
                baseUrl,
                textOf(row.selectFirst("span.jobLocation")),
                textOf(row.selectFirst("span.jobDate"))
            );
            if (parsed != null) {
                rows.add(parsed);
            }
        }
        if (!rows.isEmpty()) {
            return rows;
        }
        for (Element link : document.select("a[href]")) {
            if (!JOB_LINK.matcher(link.attr("href")).find()) {
                continue;
            }
            Element container = link.closest("tr");
            if (container == null) {
                container = closestDivWithClass(link, "(?i).*(job|result|row).*");
            }
            String location = container == null ? null : textOf(container.selectFirst("[class~=(?i)(location|city)]"));
            String posted = container == null ? null : textOf(container.selectFirst("[class~=(?i)(date|posted)]"));
            SearchRow parsed = toRow(link, baseUrl, location, posted);
            if (parsed != null) {
                rows.add(parsed);
            }
        }
        return rows;
    }

    String parseDescription(String html) {
        Document document = Jsoup.parse(html);
        Element body = document.selectFirst("[class~=(?i)(job-description|jobDescription|description)]");
        if (body == null) {
            body = document.selectFirst("div[id~=(?i)(description|job-details)]");
        }
        if (body == null) {
            body = document.selectFirst("article");
        }
        if (body == null) {
            return null;
        }
        String text = body.text();
        return text.isBlank() ? null : text;
    }

    private String fetchDescription(String url, Map<String, Integer> errors) {
        HttpFetchResult detail = httpClient.get(url, HTML_ACCEPT);
        if (!detail.hasBody()) {
            increment(errors, adapterFetchStatus("successfactors_detail", detail));
            return null;
        }
        return parseDescription(detail.body());
    }

    private SearchRow toRow(Element link, String baseUrl, String location, String posted) {
        String title = link.text();
        String url = JobUrlUtils.sanitizeCanonicalUrl(JobUrlUtils.absolutize(baseUrl + "/", link.attr("href")));
        if (title == null || title.isBlank() || url == null) {
            return null;
        }
        return new SearchRow(title.trim(), url, blankToNull(location), blankToNull(posted));
    }

    private Element closestDivWithClass(Element start, String classRegex) {
        for (Element parent : start.parents()) {
            if ("div".equals(parent.tagName()) && parent.className().matches(classRegex)) {
                return parent;
            }
        }
        return null;
    }

    private String baseUrl(String identifier) {
        if (identifier == null) {
            return null;
        }
        String value = identifier.startsWith("http://") || identifier.startsWith("https://")
            ? identifier
            : "https://" + identifier;
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return JobUrlUtils.hostOf(value) == null ? null : value;
    }

    private String textOf(Element element) {
        return element == null ? null : element.text();
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    record SearchRow(String title, String url, String location, String posted) {
    }
}
