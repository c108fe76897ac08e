package com.company.apimonitoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Channel settings. Url, sender and recipients have no committed defaults; they come from the environment.
 */
@Data
@ConfigurationProperties(prefix = "apimonitoring.notification")
public class NotificationProperties {

    private Webhook webhook = new Webhook();
    private Email email = new Email();

    @Data
    public static class Webhook {
        private boolean enabled;
        private String url;
        private int connectTimeoutSeconds = 5;
        private int readTimeoutSeconds = 10;
    }

    @Data
    public static class Email {
        private boolean enabled;
        private String from;
        private List<String> recipients = new ArrayList<>();
    }
}
