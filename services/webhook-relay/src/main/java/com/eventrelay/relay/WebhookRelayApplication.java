package com.eventrelay.relay;

import com.eventrelay.relay.config.RelayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RelayProperties.class)
public class WebhookRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebhookRelayApplication.class, args);
    }
}
