package com.eventrelay.common.idempotency.autoconfigure;

import com.eventrelay.common.idempotency.IdempotencyTemplate;
import com.eventrelay.common.idempotency.aop.IdempotentAspect;
import com.eventrelay.common.idempotency.aop.SpelKeyResolver;
import com.eventrelay.common.idempotency.store.IdempotencyStore;
import com.eventrelay.common.idempotency.store.InMemoryIdempotencyStore;
import com.eventrelay.common.idempotency.store.RedisIdempotencyStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.core.StringRedisTemplate;

@AutoConfiguration(after = {RedisAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(IdempotencyProperties.class)
public class IdempotencyAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyNamespaceProvider idempotencyNamespaceProvider(IdempotencyProperties properties, Environment env) {
        return new IdempotencyNamespaceProvider(properties, env);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyStore idempotencyStore(IdempotencyProperties properties,
                                             ObjectProvider<StringRedisTemplate> redisTemplate,
                                             ObjectProvider<ObjectMapper> objectMapper) {
        StringRedisTemplate redis = redisTemplate.getIfAvailable();
        if (properties.getStore() == IdempotencyProperties.StoreType.MEMORY || redis == null) {
            log.warn("Using in-memory idempotency store; keys are not shared across processes");
            return new InMemoryIdempotencyStore();
        }
        return new RedisIdempotencyStore(redis, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyTemplate idempotencyTemplate(IdempotencyStore store,
                                                   IdempotencyProperties properties,
                                                   IdempotencyNamespaceProvider namespaceProvider,
                                                   ObjectProvider<ObjectMapper> objectMapper) {
        return new IdempotencyTemplate(store, objectMapper.getIfAvailable(ObjectMapper::new),
                namespaceProvider.namespace(), properties.getTtl(), properties.getPendingTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public SpelKeyResolver spelKeyResolver() {
        return new SpelKeyResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    public IdempotentAspect idempotentAspect(IdempotencyTemplate template, SpelKeyResolver keyResolver) {
        return new IdempotentAspect(template, keyResolver);
    }
}
