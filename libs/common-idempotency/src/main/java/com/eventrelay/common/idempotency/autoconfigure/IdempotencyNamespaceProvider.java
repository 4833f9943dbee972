package com.eventrelay.common.idempotency.autoconfigure;

import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

public class IdempotencyNamespaceProvider {

    static final String DEFAULT_NAMESPACE = "default";
    static final int MAX_LENGTH = 200;

    private final IdempotencyProperties properties;
    private final Environment env;

    public IdempotencyNamespaceProvider(IdempotencyProperties properties, Environment env) {
        this.properties = properties;
        this.env = env;
    }

    public String namespace() {
        for (String candidate : new String[]{
                properties.getNamespace(),
                env.getProperty("spring.kafka.consumer.group-id"),
                env.getProperty("spring.application.name")}) {
            if (StringUtils.hasText(candidate)) {
                return sanitize(candidate);
            }
        }
        return DEFAULT_NAMESPACE;
    }

    static String sanitize(String raw) {
        String cleaned = raw.trim().replaceAll("\\s+", "_");
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH) : cleaned;
    }
}
