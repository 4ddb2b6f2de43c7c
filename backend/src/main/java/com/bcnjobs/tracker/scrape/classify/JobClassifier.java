package com.bcnjobs.tracker.scrape.classify;

import com.bcnjobs.tracker.scrape.model.JobClassification;
import com.bcnjobs.tracker.scrape.model.WorkType;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword heuristics that decide whether a posting is in scope. All methods are pure and null-safe.
 */
public final class JobClassifier {
    public static final int NON_ENGLISH_MARKER_THRESHOLD = 3;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL;

    private static final List<Pattern> TARGET_LOCATION_PATTERNS = compile(
        "\\bbarcelona\\b",
        "\\bbcn\\b",
        "\\bspain\\b.*\\bremote\\b",
        "\\bremote\\b.*\\bspain\\b",
        "\\bhybrid\\b.*\\bbarcelona\\b",
        "\\bbarcelona\\b.*\\bhybrid\\b"
    );

    private static final List<String> ROLE_KEYWORDS = List.of(
        "data scientist",
        "data analyst",
        "data engineer",
        "machine learning",
        "ml engineer",
        "ai engineer",
        "artificial intelligence",
        "analytics engineer",
        "applied scientist",
        "research scientist",
        "deep learning",
        "nlp engineer",
        "computer vision",
        "data science"
    );

    private static final List<String> CORE_ROLE_KEYWORDS = List.of(
        "data scientist",
        "data science",
        "machine learning engineer",
        "ml engineer",
        "mle",
        "data analyst",
        "ai engineer",
        "applied scientist",
        "research scientist",
        "deep learning",
        "nlp engineer",
        "computer vision engineer",
        "artificial intelligence"
    );

    private static final List<String> CORE_ROLE_EXCLUSIONS = List.of(
        "intern",
        "internship",
        "product manager",
        "product owner",
        "software engineer",
        "software developer",
        "backend engineer",
        "frontend engineer",
        "full stack",
        "fullstack",
        "devops",
        "sre",
        "site reliability",
        "account manager",
        "sales",
        "marketing",
        "recruiter",
        "hr ",
        "human resources",
        "content",
        "designer",
        "ux ",
        "ui ",
        "customer success",
        "support engineer",
        "qa engineer",
        "test engineer",
        "project manager",
        "program manager",
        "business analyst",
        "financial analyst",
        "junior"
    );

    private static final List<String> CORE_ROLE_DESCRIPTION_SIGNALS = List.of(
        "data scientist",
        "machine learning engineer",
        "ml engineer",
        "data analyst"
    );

    private static final List<String> VISA_KEYWORDS = List.of(
        "visa sponsorship",
        "visa sponsor",
        "visa support",
        "work permit",
        "work authorization"
    );

    private static final List<String> RELOCATION_KEYWORDS = List.of(
        "relocation",
        "relocate",
        "moving assistance",
        "moving package"
    );

    private static final List<Pattern> NON_ENGLISH_MARKERS = compileUnicodeWords(
        "somos",
        "buscamos",
        "empresa",
        "trabajo",
        "experiencia",
        "requisitos",
        "responsabilidades",
        "ofrecemos",
        "científico de datos",
        "ingeniero",
        "analista",
        "cerquem",
        "feina"
    );

    private static final Pattern REMOTE = Pattern.compile("\\bremote\\b", FLAGS);
    private static final Pattern HYBRID = Pattern.compile("\\bhybrid\\b", FLAGS);

    private JobClassifier() {
    }

    public static JobClassification classify(String title, String description, String location) {
        boolean targetLocation = isTargetLocation(location, title, description);
        boolean targetRole = isTargetRole(title, description);
        return new JobClassification(
            targetLocation,
            targetRole,
            mentionsVisaSupport(title, description),
            mentionsRelocation(title, description),
            workType(location, title),
            isCoreRole(title, description)
        );
    }

    /**
     * Target city, its airport code, or remote work combined with the target country in either order.
     */
    public static boolean isTargetLocation(String location, String title, String description) {
        String text = join(location, title, description);
        for (Pattern pattern : TARGET_LOCATION_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Broad role-family match. No exclusions are applied here.
     */
    public static boolean isTargetRole(String title, String description) {
        String text = join(title, description).toLowerCase(Locale.ROOT);
        for (String keyword : ROLE_KEYWORDS) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static int countNonEnglishMarkers(String title, String description) {
        String text = join(title, description);
        int count = 0;
        for (Pattern marker : NON_ENGLISH_MARKERS) {
            if (marker.matcher(text).find()) {
                count++;
            }
        }
        return count;
    }

    public static boolean isEnglish(String title, String description) {
        return countNonEnglishMarkers(title, description) < NON_ENGLISH_MARKER_THRESHOLD;
    }

    public static boolean mentionsVisaSupport(String title, String description) {
        return containsAny(join(title, description), VISA_KEYWORDS);
    }

    public static boolean mentionsRelocation(String title, String description) {
        return containsAny(join(title, description), RELOCATION_KEYWORDS);
    }

    /**
     * Remote first, then hybrid overrides it; anything else is on-site.
     */
    public static WorkType workType(String location, String title) {
        String text = join(location, title);
        WorkType result = WorkType.ON_SITE;
        if (REMOTE.matcher(text).find()) {
            result = WorkType.REMOTE;
        }
        if (HYBRID.matcher(text).find()) {
            result = WorkType.HYBRID;
        }
        return result;
    }

    /**
     * Strict core data/ML role check: title exclusions win, then title keywords, then strong
     * description signals.
     */
    public static boolean isCoreRole(String title, String description) {
        String titleLower = title == null ? "" : title.toLowerCase(Locale.ROOT);
        for (String exclusion : CORE_ROLE_EXCLUSIONS) {
            if (titleLower.contains(exclusion)) {
                return false;
            }
        }
        for (String keyword : CORE_ROLE_KEYWORDS) {
            if (titleLower.contains(keyword)) {
                return true;
            }
        }
        if (description == null || description.isBlank()) {
            return false;
        }
        return containsAny(description, CORE_ROLE_DESCRIPTION_SIGNALS);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String join(String... parts) {
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(part);
        }
        return out.toString();
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
            .map(regex -> Pattern.compile(regex, FLAGS))
            .toList();
    }

    private static List<Pattern> compileUnicodeWords(String... words) {
        return Arrays.stream(words)
            .map(word -> Pattern.compile(
                "\\b" + Pattern.quote(word) + "\\b",
                FLAGS | Pattern.UNICODE_CHARACTER_CLASS
            ))
            .toList();
    }
}
