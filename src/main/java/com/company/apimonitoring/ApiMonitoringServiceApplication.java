package com.company.apimonitoring;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan
@OpenAPIDefinition(
        info = @Info(
                title = "API Monitoring Service API",
                version = "1.0.0",
                description = "Anomaly detection, prediction and alert lifecycle for monitored APIs"
        )
)
public class ApiMonitoringServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiMonitoringServiceApplication.class, args);
    }
}
