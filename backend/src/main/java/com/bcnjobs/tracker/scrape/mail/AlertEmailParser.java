package com.bcnjobs.tracker.scrape.mail;

import com.bcnjobs.tracker.scrape.model.RawPosting;
import com.bcnjobs.tracker.scrape.util.JobUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts postings from the HTML body of a job-alert email. Each link pointing at the profile's
 * career site is one posting; title and location are read from the link and its enclosing block.
 */
public final class AlertEmailParser {
    private static final int MIN_TITLE_LENGTH = 5;
    private static final Set<String> GENERIC_TITLES = Set.of(
        "view job", "apply", "apply now", "learn more", "see all jobs", "view all"
    );
    private static final List<String> LOCATION_KEYWORDS = List.of(
        "Barcelona", "Sant Cugat", "Spain", "Madrid", "Remote", "Hybrid"
    );
    private static final Pattern LOCATION_PHRASE = Pattern.compile(
        "([A-Za-z\\s,]+(?:Spain|Barcelona|Madrid|Sant Cugat|Remote)[A-Za-z\\s,]*)"
    );

    private AlertEmailParser() {
    }

    public static List<RawPosting> parse(String html, AlertSourceProfile profile, String companyId, LocalDate receivedOn) {
        if (html == null || html.isBlank() || profile == null) {
            return List.of();
        }
        Document document = Jsoup.parse(html);
        List<RawPosting> postings = new ArrayList<>();
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href");
            if (!profile.matchesUrl(href) || isHousekeepingLink(href)) {
                continue;
            }
            String title = titleFor(link);
            if (title == null) {
                continue;
            }
            String url = JobUrlUtils.normalizeAlertUrl(href);
            if (url == null) {
                continue;
            }
            postings.add(new RawPosting(companyId, title, url, locationFor(link), null, receivedOn, null));
        }
        return postings;
    }

    /**
     * Link text, or the nearest heading or emphasis when the link text is short or boilerplate
     * ("Apply", "View job"). Null when neither names the job.
     */
    static String titleFor(Element link) {
        String text = link.text().trim();
        if (text.length() >= MIN_TITLE_LENGTH && !isGeneric(text)) {
            return text;
        }
        Element container = link.closest("tr, div, td");
        if (container == null) {
            return null;
        }
        Element heading = container.selectFirst("h2, h3, h4, strong, b");
        if (heading == null) {
            return null;
        }
        String headingText = heading.text().trim();
        return headingText.isEmpty() || isGeneric(headingText) ? null : headingText;
    }

    static String locationFor(Element link) {
        Element container = link.closest("tr, div, td, li");
        if (container == null) {
            return null;
        }
        for (Element element : container.getAllElements()) {
            String text = element.ownText();
            if (text.isBlank()) {
                continue;
            }
            for (String keyword : LOCATION_KEYWORDS) {
                if (!text.contains(keyword)) {
                    continue;
                }
                Matcher matcher = LOCATION_PHRASE.matcher(text);
                return matcher.find() ? matcher.group(1).trim() : keyword;
            }
        }
        return null;
    }

    private static boolean isGeneric(String text) {
        return GENERIC_TITLES.contains(text.toLowerCase(Locale.ROOT));
    }

    private static boolean isHousekeepingLink(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        return lower.contains("unsubscribe") || lower.contains("privacy");
    }
}
