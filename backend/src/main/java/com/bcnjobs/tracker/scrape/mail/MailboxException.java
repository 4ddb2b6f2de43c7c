package com.bcnjobs.tracker.scrape.mail;

public class MailboxException extends Exception {
    public MailboxException(String message) {
        super(message);
    }

    public MailboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
