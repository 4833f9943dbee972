package com.eventrelay.common.idempotency.store;

import com.eventrelay.common.idempotency.IdempotencyRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ConcurrentMap<String, IdempotencyRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdempotencyStore() {
        this(Clock.systemUTC());
    }

    public InMemoryIdempotencyStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        IdempotencyRecord record = records.computeIfPresent(key, (k, existing) -> expired(existing) ? null : existing);
        return Optional.ofNullable(record);
    }

    @Override
    public boolean createPending(String key, Duration ttl) {
        AtomicBoolean created = new AtomicBoolean(false);
        records.compute(key, (k, existing) -> {
            if (existing != null && !expired(existing)) {
                return existing;
            }
            created.set(true);
            return IdempotencyRecord.pending(k, clock.millis() + ttl.toMillis());
        });
        return created.get();
    }

    @Override
    public void complete(String key, JsonNode response, Duration ttl) {
        records.put(key, IdempotencyRecord.completed(key, response, clock.millis() + ttl.toMillis()));
    }

    @Override
    public void delete(String key) {
        records.remove(key);
    }

    public int size() {
        return records.size();
    }

    private boolean expired(IdempotencyRecord record) {
        return record.expiresAt() != null && record.expiresAt() <= clock.millis();
    }
}
