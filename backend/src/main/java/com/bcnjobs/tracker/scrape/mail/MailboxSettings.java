package com.bcnjobs.tracker.scrape.mail;

import com.bcnjobs.tracker.config.TrackerProperties;

public record MailboxSettings(
    String host,
    int port,
    String folder,
    String address,
    String appPassword,
    int timeoutMs
) {
    /**
     * Returns null when no credentials are configured.
     */
    public static MailboxSettings from(TrackerProperties.Mail mail) {
        if (mail == null || !mail.hasCredentials()) {
            return null;
        }
        return new MailboxSettings(
            mail.getHost(),
            mail.getPort(),
            mail.getFolder(),
            mail.getAddress().trim(),
            mail.getAppPassword(),
            mail.getTimeoutMs()
        );
    }

    @Override
    public String toString() {
        return "MailboxSettings[host=" + host + ", port=" + port + ", folder=" + folder + ", address=" + address + "]";
    }
}
