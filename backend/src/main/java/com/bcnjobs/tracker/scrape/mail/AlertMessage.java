package com.bcnjobs.tracker.scrape.mail;

import java.time.Instant;

/**
 * One alert email reduced to what link extraction needs. {@code body} is the HTML part when the
 * message has one, otherwise the plain-text part.
 */
public record AlertMessage(
    String sender,
    String subject,
    Instant receivedAt,
    String body
) {
}
