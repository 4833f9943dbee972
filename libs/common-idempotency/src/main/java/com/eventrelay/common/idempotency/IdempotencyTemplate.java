package com.eventrelay.common.idempotency;

import com.eventrelay.common.idempotency.store.IdempotencyStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Runs an operation at most once to completion per key.
 *
 * <ul>
 *   <li>completed record present: the cached response is returned, the operation is not invoked;</li>
 *   <li>pending record present: {@link IdempotencyConflictException}, without waiting;</li>
 *   <li>otherwise a pending lock is created; on success the record becomes completed with the
 *   response, on failure it is deleted so a later attempt can take the lock again.</li>
 * </ul>
 */
public class IdempotencyTemplate {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyTemplate.class);

    private final IdempotencyStore store;
    private final ObjectMapper objectMapper;
    private final String namespace;
    private final Duration ttl;
    private final Duration pendingTtl;

    public IdempotencyTemplate(IdempotencyStore store, ObjectMapper objectMapper, String namespace, Duration ttl) {
        this(store, objectMapper, namespace, ttl, ttl);
    }

    public IdempotencyTemplate(IdempotencyStore store, ObjectMapper objectMapper, String namespace,
                               Duration ttl, Duration pendingTtl) {
        this.store = Objects.requireNonNull(store, "store");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.namespace = namespace;
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.pendingTtl = pendingTtl == null ? ttl : pendingTtl;
    }

    public <T> T execute(String key, Class<T> responseType, Callable<T> operation) throws Exception {
        String storeKey = IdempotencyKeys.compact(IdempotencyKeys.join(namespace, IdempotencyKeys.validate(key)));

        Optional<IdempotencyRecord> existing = find(storeKey);
        if (existing.isPresent()) {
            return resolveExisting(storeKey, existing.get(), responseType);
        }
        if (!createPending(storeKey)) {
            // lost the create race; the winner may already be done
            IdempotencyRecord current = find(storeKey)
                    .orElseThrow(() -> new IdempotencyConflictException(storeKey));
            return resolveExisting(storeKey, current, responseType);
        }

        T result;
        try {
            result = operation.call();
        } catch (Exception | Error e) {
            release(storeKey);
            throw e;
        }
        try {
            store.complete(storeKey, objectMapper.valueToTree(result), ttl);
        } catch (RuntimeException e) {
            log.warn("Idempotent markDone failed, key={}", IdempotencyKeys.mask(storeKey), e);
            throw new IdempotencyMarkDoneFailedException(
                    "Idempotent markDone failed, key=" + IdempotencyKeys.mask(storeKey), result, e);
        }
        return result;
    }

    public void execute(String key, Runnable operation) throws Exception {
        execute(key, Object.class, () -> {
            operation.run();
            return null;
        });
    }

    private Optional<IdempotencyRecord> find(String storeKey) {
        try {
            return store.find(storeKey);
        } catch (IdempotencyStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IdempotencyStoreException("Idempotency lookup failed key=" + IdempotencyKeys.mask(storeKey), e);
        }
    }

    private boolean createPending(String storeKey) {
        try {
            return store.createPending(storeKey, pendingTtl);
        } catch (IdempotencyStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IdempotencyStoreException("Idempotency lock failed key=" + IdempotencyKeys.mask(storeKey), e);
        }
    }

    private <T> T resolveExisting(String storeKey, IdempotencyRecord record, Class<T> responseType) {
        if (!record.isCompleted()) {
            throw new IdempotencyConflictException(storeKey);
        }
        log.debug("Idempotent cache hit key={}", IdempotencyKeys.mask(storeKey));
        return convert(storeKey, record.response(), responseType);
    }

    private <T> T convert(String storeKey, JsonNode response, Class<T> responseType) {
        if (response == null || response.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(response, responseType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cached response does not map to " + responseType.getSimpleName()
                    + " key=" + IdempotencyKeys.mask(storeKey), e);
        }
    }

    private void release(String storeKey) {
        try {
            store.delete(storeKey);
        } catch (RuntimeException e) {
            log.warn("Release idempotency key failed key={}", IdempotencyKeys.mask(storeKey), e);
        }
    }
}
