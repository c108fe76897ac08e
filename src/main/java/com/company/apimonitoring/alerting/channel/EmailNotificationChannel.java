package com.company.apimonitoring.alerting.channel;

import com.company.apimonitoring.domain.Alert;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * SMTP delivery with a plain-text and an HTML part. Runs on the notification executor,
 * never on the alerting cycle thread.
 */
@Slf4j
public class EmailNotificationChannel implements NotificationChannel {

    public static final String NAME = "email";

    private static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final JavaMailSender mailSender;
    private final String from;
    private final List<String> recipients;

    public EmailNotificationChannel(JavaMailSender mailSender, String from, List<String> recipients) {
        this.mailSender = mailSender;
        this.from = from;
        this.recipients = List.copyOf(recipients);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean sendAlert(Alert alert) {
        if (recipients.isEmpty()) {
            log.warn("No email recipients configured, alert {} not sent", alert.getId());
            return false;
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(from);
            helper.setTo(recipients.toArray(new String[0]));
            helper.setSubject(subject(alert));
            helper.setText(textBody(alert), htmlBody(alert));
            mailSender.send(message);
            log.info("Sent alert {} by email to {} recipients", alert.getId(), recipients.size());
            return true;
        } catch (MessagingException | MailException e) {
            log.error("Failed to send alert {} by email: {}", alert.getId(), e.getMessage());
            return false;
        }
    }

    static String subject(Alert alert) {
        String severity = alert.getSeverity() != null ? alert.getSeverity().getValue().toUpperCase(Locale.ROOT) : "UNKNOWN";
        return severity + " Alert: " + alert.getTitle();
    }

    static String textBody(Alert alert) {
        return "API Monitoring Service Alert\n\n"
                + alert.getTitle() + "\n\n"
                + "Alert ID: " + alert.getId() + "\n"
                + "Severity: " + value(alert.getSeverity() != null ? alert.getSeverity().getValue() : null) + "\n"
                + "Status: " + value(alert.getStatus() != null ? alert.getStatus().getValue() : null) + "\n"
                + "API: " + String.join(", ", alert.getApis()) + "\n"
                + "Environment: " + environments(alert) + "\n"
                + "Created At: " + createdAt(alert) + "\n\n"
                + "Description:\n" + value(alert.getDescription()) + "\n";
    }

    static String htmlBody(Alert alert) {
        return "<html><body>"
                + "<h2>API Monitoring Service Alert</h2>"
                + "<h3>" + escape(alert.getTitle()) + "</h3>"
                + row("Alert ID", alert.getId())
                + row("Severity", alert.getSeverity() != null ? alert.getSeverity().getValue() : null)
                + row("Status", alert.getStatus() != null ? alert.getStatus().getValue() : null)
                + row("API", String.join(", ", alert.getApis()))
                + row("Environment", environments(alert))
                + row("Created At", createdAt(alert))
                + "<p><strong>Description:</strong><br>" + escape(alert.getDescription()) + "</p>"
                + "</body></html>";
    }

    private static String row(String label, String value) {
        return "<p><strong>" + label + ":</strong> " + escape(value) + "</p>";
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value(value));
    }

    private static String value(String value) {
        return value != null ? value : "";
    }

    private static String environments(Alert alert) {
        return alert.getEnvironments().stream().map(env -> env.getValue()).collect(Collectors.joining(", "));
    }

    private static String createdAt(Alert alert) {
        return alert.getCreatedAt() != null ? CREATED_AT_FORMAT.format(alert.getCreatedAt()) : "";
    }
}
