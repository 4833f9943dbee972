package com.eventrelay.common.idempotency.store;

import com.eventrelay.common.idempotency.IdempotencyRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value storage behind {@link com.eventrelay.common.idempotency.IdempotencyTemplate}.
 * Keys passed in are already namespaced.
 */
public interface IdempotencyStore {

    Optional<IdempotencyRecord> find(String key);

    /**
     * Create-if-absent write of a pending record. Never overwrites.
     *
     * @return {@code false} when any record already exists for the key
     */
    boolean createPending(String key, Duration ttl);

    void complete(String key, JsonNode response, Duration ttl);

    void delete(String key);
}
