package com.bcnjobs.tracker.scrape.mail;

import java.time.LocalDate;
import java.util.List;

/**
 * An open, authenticated mailbox. Closing it logs out and releases the connection.
 */
public interface MailboxSession extends AutoCloseable {

    /**
     * Messages from {@code sender} received on or after {@code since}.
     */
    List<AlertMessage> search(String sender, LocalDate since) throws MailboxException;

    @Override
    void close();
}
