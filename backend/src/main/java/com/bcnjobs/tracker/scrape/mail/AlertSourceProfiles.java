package com.bcnjobs.tracker.scrape.mail;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in alert sources, keyed by the name used as source identifier in the company registry.
 */
public final class AlertSourceProfiles {
    private static final Map<String, AlertSourceProfile> PROFILES = new LinkedHashMap<>();

    static {
        register(AlertSourceProfile.of(
            "microsoft",
            List.of(
                "donotreply@email.careers.microsoft.com",
                "careers@microsoft.com",
                "microsoft@talent.icims.com",
                "noreply@microsoft.com",
                "jobs-noreply@linkedin.com"
            ),
            "careers\\.microsoft\\.com",
            "jobs\\.careers\\.microsoft\\.com",
            "microsoft\\.eightfold\\.ai"
        ));
        register(AlertSourceProfile.of(
            "hp",
            List.of(
                "careers@hp.com",
                "noreply@hp.com",
                "hp@talent.icims.com",
                "no-reply@eightfold.ai",
                "hp@eightfold.ai"
            ),
            "apply\\.hp\\.com",
            "hp\\.com/careers",
            "jobs\\.hp\\.com"
        ));
        register(AlertSourceProfile.of(
            "revolut",
            List.of(
                "careers@revolut.com",
                "noreply@revolut.com",
                "talent@revolut.com",
                "jobs@revolut.com"
            ),
            "revolut\\.com/careers",
            "revolut\\.com/.*position"
        ));
    }

    private AlertSourceProfiles() {
    }

    private static void register(AlertSourceProfile profile) {
        PROFILES.put(profile.name(), profile);
    }

    public static AlertSourceProfile find(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return PROFILES.get(name.trim().toLowerCase(Locale.ROOT));
    }

    public static List<AlertSourceProfile> all() {
        return List.copyOf(PROFILES.values());
    }
}
