package com.wafsentinel.engine.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.List;

/**
 * Plain-text mail to the configured operators. Transport timeouts come from
 * the {@code spring.mail.properties.mail.smtp.*timeout} settings.
 *
 * @author WAF Sentinel Team
 */
public class MailNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(MailNotificationChannel.class);

    private final JavaMailSender mailSender;
    private final String from;
    private final List<String> recipients;

    public MailNotificationChannel(JavaMailSender mailSender, String from, List<String> recipients) {
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("Mail notifications need at least one recipient");
        }
        this.mailSender = mailSender;
        this.from = from;
        this.recipients = List.copyOf(recipients);
    }

    @Override
    public String name() {
        return "mail";
    }

    @Override
    public void send(NotificationEvent event) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(recipients.toArray(new String[0]));
        message.setSubject("[WAF Sentinel][" + event.severity() + "] " + event.subject());
        message.setText(event.body() + "\n\nEvent: " + event.kind().getDisplayName() + " " + event.eventId()
                + "\nRaised at: " + event.timestamp() + "\n");
        try {
            mailSender.send(message);
            log.debug("Mail sent for notification {} to {}", event.eventId(), recipients);
        } catch (MailException e) {
            throw new NotificationException("Mail delivery failed: " + e.getMessage(), e);
        }
    }
}
