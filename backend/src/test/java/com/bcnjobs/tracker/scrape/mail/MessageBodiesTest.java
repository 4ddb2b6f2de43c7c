package com.bcnjobs.tracker.scrape.mail;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class MessageBodiesTest {
    private final Session session = Session.getInstance(new Properties());

    @Test
    void prefersHtmlAlternative() throws Exception {
        MimeBodyPart plain = new MimeBodyPart();
        plain.setText("plain body", "UTF-8");
        MimeBodyPart html = new MimeBodyPart();
        html.setContent("<p>html body</p>", "text/html; charset=UTF-8");
        MimeMultipart alternative = new MimeMultipart("alternative");
        alternative.addBodyPart(plain);
        alternative.addBodyPart(html);
        MimeMessage message = new MimeMessage(session);
        message.setContent(alternative);
        message.saveChanges();

        assertThat(MessageBodies.preferredBody(message)).isEqualTo("<p>html body</p>");
    }

    @Test
    void fallsBackToPlainText() throws Exception {
        MimeMessage message = new MimeMessage(session);
        message.setText("only plain", "UTF-8");
        message.saveChanges();

        assertThat(MessageBodies.preferredBody(message)).isEqualTo("only plain");
    }
}
