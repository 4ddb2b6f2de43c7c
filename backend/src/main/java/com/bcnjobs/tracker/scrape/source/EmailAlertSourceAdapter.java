package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.mail.AlertEmailParser;
import com.bcnjobs.tracker.scrape.mail.AlertMessage;
import com.bcnjobs.tracker.scrape.mail.AlertSourceProfile;
import com.bcnjobs.tracker.scrape.mail.AlertSourceProfiles;
import com.bcnjobs.tracker.scrape.mail.MailboxAuthenticationException;
import com.bcnjobs.tracker.scrape.mail.MailboxClient;
import com.bcnjobs.tracker.scrape.mail.MailboxException;
import com.bcnjobs.tracker.scrape.mail.MailboxSession;
import com.bcnjobs.tracker.scrape.mail.MailboxSettings;
import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.RawPosting;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads job-alert emails for companies whose career sites cannot be queried directly. The registry
 * identifier names a built-in {@link AlertSourceProfile}; without one the company id is used.
 * Mailbox credentials are optional and their absence skips the source.
 */
@Component
public class EmailAlertSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(EmailAlertSourceAdapter.class);

    private final MailboxClient mailboxClient;
    private final MailboxSettings settings;
    private final int daysBack;
    private final Clock clock;

    public EmailAlertSourceAdapter(MailboxClient mailboxClient, TrackerProperties properties, Clock clock) {
        this.mailboxClient = mailboxClient;
        this.settings = MailboxSettings.from(properties.getMail());
        this.daysBack = properties.getMail().getDaysBack();
        this.clock = clock;
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.EMAIL_ALERT;
    }

    @Override
    public SourceFetchResult fetch(CompanyEntry company) {
        if (settings == null) {
            log.info("Mailbox credentials not configured, skipping email alerts for {}", company.id());
            return SourceFetchResult.skipped("mail credentials not configured");
        }
        String profileName = company.hasSourceIdentifier() ? company.sourceIdentifier().trim() : company.id();
        AlertSourceProfile profile = AlertSourceProfiles.find(profileName);
        if (profile == null) {
            log.warn("No alert profile named '{}' for {}", profileName, company.id());
            return SourceFetchResult.skipped("unknown alert profile " + profileName);
        }

        LocalDate since = LocalDate.now(clock).minusDays(daysBack);
        Map<String, Integer> errors = new LinkedHashMap<>();
        Map<String, RawPosting> postingsByUrl = new LinkedHashMap<>();
        try (MailboxSession session = mailboxClient.open(settings)) {
            for (String sender : profile.senders()) {
                List<AlertMessage> messages;
                try {
                    messages = session.search(sender, since);
                } catch (MailboxException e) {
                    log.debug("Alert search for {} failed: {}", sender, e.getMessage());
                    increment(errors, "email_search_error");
                    continue;
                }
                for (AlertMessage message : messages) {
                    LocalDate receivedOn = message.receivedAt() == null
                        ? null
                        : message.receivedAt().atZone(ZoneOffset.UTC).toLocalDate();
                    List<RawPosting> parsed;
                    try {
                        parsed = AlertEmailParser.parse(message.body(), profile, company.id(), receivedOn);
                    } catch (RuntimeException e) {
                        log.debug("Could not extract postings from '{}'", message.subject(), e);
                        increment(errors, "email_parse_error");
                        continue;
                    }
                    for (RawPosting posting : parsed) {
                        postingsByUrl.putIfAbsent(posting.url(), posting);
                    }
                }
            }
        } catch (MailboxAuthenticationException e) {
            log.warn("Mailbox authentication failed for {}: {}", settings.address(), e.getMessage());
            return SourceFetchResult.skipped("mail authentication failed");
        } catch (MailboxException e) {
            log.warn("Mailbox unavailable for {}: {}", company.id(), e.getMessage());
            increment(errors, "email_connection_error");
            return SourceFetchResult.failed(errors, "email_connection_error");
        }

        List<JobRecord> records = new ArrayList<>();
        for (RawPosting posting : postingsByUrl.values()) {
            JobRecord candidate = JobRecordFactory.toCandidate(posting, false);
            if (candidate != null) {
                records.add(candidate);
            }
        }
        log.info("{} [{}]: found {} matching jobs from {} total", family(), company.id(), records.size(), postingsByUrl.size());
        return SourceFetchResult.success(records, postingsByUrl.size(), errors);
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.put(key, errors.getOrDefault(key, 0) + 1);
    }
}
