package com.company.apimonitoring.config;

import com.company.apimonitoring.alerting.channel.EmailNotificationChannel;
import com.company.apimonitoring.alerting.channel.NotificationChannel;
import com.company.apimonitoring.alerting.channel.WebhookNotificationChannel;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates the enabled notification channels. A channel whose url or sender is blank
 * is not registered.
 */
@Configuration
@Slf4j
public class NotificationConfig {

    public static final String WEBHOOK_CIRCUIT_BREAKER = "webhookNotification";

    @Bean
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder, NotificationProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(properties.getWebhook().getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(properties.getWebhook().getReadTimeoutSeconds()))
                .build();
    }

    @Bean
    @ConditionalOnExpression("${apimonitoring.notification.webhook.enabled:false} "
            + "and '${apimonitoring.notification.webhook.url:}' != ''")
    public NotificationChannel webhookNotificationChannel(RestTemplate notificationRestTemplate,
                                                          NotificationProperties properties,
                                                          CircuitBreakerRegistry circuitBreakerRegistry) {
        log.info("Webhook notification channel enabled");
        return new WebhookNotificationChannel(notificationRestTemplate, properties.getWebhook().getUrl(),
                circuitBreakerRegistry.circuitBreaker(WEBHOOK_CIRCUIT_BREAKER));
    }

    @Bean
    @ConditionalOnExpression("${apimonitoring.notification.email.enabled:false} "
            + "and '${apimonitoring.notification.email.from:}' != '' and '${spring.mail.host:}' != ''")
    public NotificationChannel emailNotificationChannel(JavaMailSender mailSender, NotificationProperties properties) {
        NotificationProperties.Email email = properties.getEmail();
        List<String> recipients = email.getRecipients().stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .collect(Collectors.toList());
        if (recipients.isEmpty()) {
            log.warn("Email notifications enabled without recipients, every delivery will fail");
        }
        log.info("Email notification channel enabled for {} recipients", recipients.size());
        return new EmailNotificationChannel(mailSender, email.getFrom(), recipients);
    }
}
