package com.bcnjobs.tracker.scrape.mail;

import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;

import java.io.IOException;

/**
 * Picks the body of a MIME message, preferring the HTML part over plain text.
 */
final class MessageBodies {
    private MessageBodies() {
    }

    static String preferredBody(Part message) throws MessagingException, IOException {
        String html = firstOfType(message, "text/html");
        if (html != null && !html.isBlank()) {
            return html;
        }
        return firstOfType(message, "text/plain");
    }

    private static String firstOfType(Part part, String mimeType) throws MessagingException, IOException {
        if (part.isMimeType(mimeType)) {
            Object content = part.getContent();
            return content instanceof String text ? text : null;
        }
        if (part.isMimeType("multipart/*")) {
            Object content = part.getContent();
            if (!(content instanceof Multipart multipart)) {
                return null;
            }
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart child = multipart.getBodyPart(i);
                if (Part.ATTACHMENT.equalsIgnoreCase(child.getDisposition())) {
                    continue;
                }
                String found = firstOfType(child, mimeType);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
