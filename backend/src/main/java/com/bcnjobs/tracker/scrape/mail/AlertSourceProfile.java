package com.bcnjobs.tracker.scrape.mail;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Senders a job-alert source mails from, and the link patterns that identify its postings.
 */
public record AlertSourceProfile(String name, List<String> senders, List<Pattern> urlPatterns) {
    public AlertSourceProfile {
        senders = senders == null ? List.of() : List.copyOf(senders);
        urlPatterns = urlPatterns == null ? List.of() : List.copyOf(urlPatterns);
    }

    static AlertSourceProfile of(String name, List<String> senders, String... urlRegexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : urlRegexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return new AlertSourceProfile(name, senders, patterns);
    }

    public boolean matchesUrl(String href) {
        if (href == null || href.isBlank()) {
            return false;
        }
        for (Pattern pattern : urlPatterns) {
            if (pattern.matcher(href).find()) {
                return true;
            }
        }
        return false;
    }
}
