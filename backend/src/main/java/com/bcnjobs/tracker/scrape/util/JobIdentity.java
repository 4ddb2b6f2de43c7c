package com.bcnjobs.tracker.scrape.util;

/**
 * Derives the primary key of a stored posting from its company and application URL.
 */
public final class JobIdentity {
    public static final int KEY_LENGTH = 16;

    private JobIdentity() {
    }

    /**
     * First 16 hex characters of SHA-256 over {@code companyId + ":" + url}.
     *
     * @throws IllegalArgumentException if either part is blank
     */
    public static String identityKey(String companyId, String url) {
        if (companyId == null || companyId.isBlank()) {
            throw new IllegalArgumentException("companyId is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        return HashUtils.sha256Hex(companyId + ":" + url, KEY_LENGTH);
    }
}
