package com.bcnjobs.tracker.scrape.mail;

public interface MailboxClient {

    /**
     * @throws MailboxAuthenticationException when the credentials are rejected
     * @throws MailboxException when the store cannot be reached or the folder cannot be opened
     */
    MailboxSession open(MailboxSettings settings) throws MailboxException;
}
