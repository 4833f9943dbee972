package com.eventrelay.common.retry.autoconfigure;

import com.eventrelay.common.retry.RetryPolicy;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(RetryProperties.class)
public class RetryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(RetryProperties properties) {
        return new RetryPolicy(properties.toOptions());
    }
}
