package com.bcnjobs.tracker.scrape.mail;

/**
 * The mail store rejected the configured credentials.
 */
public class MailboxAuthenticationException extends MailboxException {
    public MailboxAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
