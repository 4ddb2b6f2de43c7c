package com.bcnjobs.tracker.scrape.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class JobUrlUtils {
    private static final Set<String> TRACKING_PARAMS = Set.of(
        "gclid",
        "fbclid",
        "mc_cid",
        "mc_eid",
        "trk",
        "trackingid",
        "refid",
        "source",
        "src"
    );

    private JobUrlUtils() {
    }

    /**
     * Validates an application URL taken from a structured payload and strips tracking parameters.
     * Returns null when the URL is not a usable http(s) posting link.
     */
    public static String sanitizeCanonicalUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        if (trimmed.toLowerCase(Locale.ROOT).contains("invalid-url")) {
            return null;
        }
        URI uri = safeUri(trimmed);
        if (!isHttpWithHost(uri)) {
            return null;
        }
        if (isAtsApiUrl(uri)) {
            return null;
        }
        return stripTrackingParams(trimmed);
    }

    /**
     * Normalizes a link found in an alert email: scheme-relative and scheme-less links become https,
     * and the whole query string is dropped.
     */
    public static String normalizeAlertUrl(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String value = href.trim();
        if (value.startsWith("//")) {
            value = "https:" + value;
        } else if (!value.regionMatches(true, 0, "http://", 0, 7) && !value.regionMatches(true, 0, "https://", 0, 8)) {
            if (value.contains(":") && !value.contains("/")) {
                return null;
            }
            value = "https://" + value;
        }
        value = stripQueryAndFragment(value);
        URI uri = safeUri(value);
        if (!isHttpWithHost(uri)) {
            return null;
        }
        return value;
    }

    public static String stripTrackingParams(String url) {
        if (url == null) {
            return null;
        }
        String value = url;
        int hashIdx = value.indexOf('#');
        if (hashIdx >= 0) {
            value = value.substring(0, hashIdx);
        }
        int queryIdx = value.indexOf('?');
        if (queryIdx < 0) {
            return value;
        }
        String base = value.substring(0, queryIdx);
        String query = value.substring(queryIdx + 1);
        List<String> kept = new ArrayList<>();
        for (String part : query.split("&")) {
            if (part == null || part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            String key = (eq >= 0 ? part.substring(0, eq) : part).toLowerCase(Locale.ROOT);
            if (key.startsWith("utm_") || TRACKING_PARAMS.contains(key)) {
                continue;
            }
            kept.add(part);
        }
        return kept.isEmpty() ? base : base + "?" + String.join("&", kept);
    }

    public static String stripQueryAndFragment(String value) {
        if (value == null) {
            return null;
        }
        String result = value;
        int idx = result.indexOf('?');
        if (idx >= 0) {
            result = result.substring(0, idx);
        }
        int hashIdx = result.indexOf('#');
        if (hashIdx >= 0) {
            result = result.substring(0, hashIdx);
        }
        return result;
    }

    /**
     * Resolves {@code href} against {@code baseUrl}; absolute hrefs are returned unchanged.
     */
    public static String absolutize(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        URI base = safeUri(baseUrl);
        if (base == null) {
            return null;
        }
        try {
            return base.resolve(trimmed).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean isAtsApiUrl(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        if (host.contains("boards-api.greenhouse.io") || host.contains("api.greenhouse.io")) {
            return true;
        }
        if (host.contains("api.lever.co") && path.contains("/postings/")) {
            return true;
        }
        if (host.equals("api.ashbyhq.com") || host.equals("api.smartrecruiters.com")) {
            return true;
        }
        if (host.contains("workable.com") && path.startsWith("/api/")) {
            return true;
        }
        if (host.contains("myworkdayjobs.com") && path.contains("/wday/cxs/")) {
            return true;
        }
        return false;
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url);
        return uri == null || uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean isHttpWithHost(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return false;
        }
        String scheme = uri.getScheme();
        return scheme != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
    }
}
