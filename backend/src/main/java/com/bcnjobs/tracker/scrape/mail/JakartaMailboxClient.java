package com.bcnjobs.tracker.scrape.mail;

import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * IMAP over SSL through Jakarta Mail. Folders are opened read-only.
 */
@Component
public class JakartaMailboxClient implements MailboxClient {
    private static final Logger log = LoggerFactory.getLogger(JakartaMailboxClient.class);

    @Override
    public MailboxSession open(MailboxSettings settings) throws MailboxException {
        Session session = Session.getInstance(sessionProperties(settings));
        Store store = null;
        try {
            store = session.getStore("imaps");
            store.connect(settings.host(), settings.port(), settings.address(), settings.appPassword());
            Folder folder = store.getFolder(settings.folder());
            folder.open(Folder.READ_ONLY);
            return new JakartaMailboxSession(store, folder);
        } catch (AuthenticationFailedException e) {
            closeStore(store);
            throw new MailboxAuthenticationException("Mailbox rejected credentials for " + settings.address(), e);
        } catch (MessagingException e) {
            closeStore(store);
            throw new MailboxException("Unable to open mailbox at " + settings.host() + ": " + e.getMessage(), e);
        }
    }

    private Properties sessionProperties(MailboxSettings settings) {
        Properties props = new Properties();
        props.put("mail.store.protocol", "imaps");
        props.put("mail.imaps.host", settings.host());
        props.put("mail.imaps.port", String.valueOf(settings.port()));
        props.put("mail.imaps.ssl.enable", "true");
        props.put("mail.imaps.connectiontimeout", String.valueOf(settings.timeoutMs()));
        props.put("mail.imaps.timeout", String.valueOf(settings.timeoutMs()));
        return props;
    }

    private static void closeStore(Store store) {
        if (store == null || !store.isConnected()) {
            return;
        }
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Error closing mail store", e);
        }
    }

    private static final class JakartaMailboxSession implements MailboxSession {
        private final Store store;
        private final Folder folder;

        private JakartaMailboxSession(Store store, Folder folder) {
            this.store = store;
            this.folder = folder;
        }

        @Override
        public List<AlertMessage> search(String sender, LocalDate since) throws MailboxException {
            Date sinceDate = Date.from(since.atStartOfDay(ZoneOffset.UTC).toInstant());
            SearchTerm term = new AndTerm(
                new FromStringTerm(sender),
                new ReceivedDateTerm(ComparisonTerm.GE, sinceDate)
            );
            try {
                Message[] messages = folder.search(term);
                List<AlertMessage> out = new ArrayList<>(messages.length);
                for (Message message : messages) {
                    out.add(new AlertMessage(
                        firstFrom(message),
                        message.getSubject(),
                        receivedAt(message),
                        MessageBodies.preferredBody(message)
                    ));
                }
                return out;
            } catch (MessagingException | IOException e) {
                throw new MailboxException("Search for " + sender + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                if (folder.isOpen()) {
                    folder.close(false);
                }
            } catch (MessagingException e) {
                log.debug("Error closing mail folder", e);
            }
            closeStore(store);
        }

        private String firstFrom(Message message) throws MessagingException {
            Address[] from = message.getFrom();
            return from == null || from.length == 0 ? null : from[0].toString();
        }

        private Instant receivedAt(Message message) throws MessagingException {
            Date received = message.getReceivedDate();
            if (received == null) {
                received = message.getSentDate();
            }
            return received == null ? null : received.toInstant();
        }
    }
}
