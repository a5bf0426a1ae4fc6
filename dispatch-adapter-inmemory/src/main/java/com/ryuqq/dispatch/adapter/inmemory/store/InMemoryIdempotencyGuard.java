package com.ryuqq.dispatch.adapter.inmemory.store;

import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.model.IdempotencyKey;
import com.ryuqq.dispatch.core.model.IdempotencyRecord;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.spi.Admission;
import com.ryuqq.dispatch.core.spi.IdempotencyGuard;
import com.ryuqq.dispatch.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link IdempotencyGuard} for single-process deployments and tests.
 *
 * <p><strong>At-most-once Guarantee:</strong></p>
 * <ul>
 *   <li>{@link #begin} runs the whole check-and-mark step inside {@link ConcurrentHashMap#compute},
 *       so exactly one of many concurrent callers with the same key is {@code Admitted}</li>
 *   <li>Contention is per key; unrelated keys never block each other</li>
 *   <li>Expired completed records are treated as absent and replaced on the next {@code begin}</li>
 *   <li>In-flight records never expire</li>
 * </ul>
 *
 * <p><strong>Waiters:</strong> every in-flight record owns a completion future. It is completed
 * with the stored result on {@link #complete} and with {@code Optional.empty()} on {@link #release}
 * or {@link #reset}, always outside the map operation. Callers receive a copy, so cancelling it
 * never affects other waiters.</p>
 *
 * <p><strong>Request fingerprint:</strong> the fingerprint passed to the admitted call is stored
 * with the record. A later {@code begin} with a different non-null fingerprint gets {@code Mismatch}.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class InMemoryIdempotencyGuard implements IdempotencyGuard {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIdempotencyGuard.class);

    private final ConcurrentHashMap<IdempotencyKey, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Creates a guard backed by the system clock.
     */
    public InMemoryIdempotencyGuard() {
        this(Clock.system());
    }

    /**
     * Creates a guard backed by the given clock.
     *
     * @param clock monotonic time source for expiry
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryIdempotencyGuard(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Admission begin(IdempotencyKey key, Object fingerprint) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }

        Admission[] admission = new Admission[1];
        store.compute(key, (k, existing) -> {
            long now = clock.monotonicNanos();
            if (existing == null || existing.record.isExpired(now)) {
                admission[0] = new Admission.Admitted(k);
                return Entry.inFlight(IdempotencyRecord.inFlight(k, now), fingerprint);
            }
            if (!existing.matches(fingerprint)) {
                admission[0] = new Admission.Mismatch(k);
            } else if (existing.record.isCompleted()) {
                admission[0] = new Admission.Duplicate(k, existing.record.result());
            } else {
                admission[0] = new Admission.DuplicateInFlight(k, existing.completion.copy());
            }
            return existing;
        });

        log.debug("Idempotency admission for {}: {}", key, admission[0].getClass().getSimpleName());
        return admission[0];
    }

    @Override
    public void complete(IdempotencyKey key, Result<?, DispatchError> result, Duration ttl) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }

        Entry[] previous = new Entry[1];
        store.compute(key, (k, existing) -> {
            long now = clock.monotonicNanos();
            if (existing != null && existing.record.isCompleted() && !existing.record.isExpired(now)) {
                throw new IllegalStateException("Idempotency record already completed: " + k);
            }
            boolean inFlight = existing != null && !existing.record.isCompleted();
            IdempotencyRecord base = inFlight ? existing.record : IdempotencyRecord.inFlight(k, now);
            previous[0] = inFlight ? existing : null;
            return Entry.completed(base.complete(result, now, ttl), inFlight ? existing.fingerprint : null);
        });

        if (previous[0] != null) {
            previous[0].completion.complete(Optional.of(result));
        }
        log.debug("Completed idempotency record {} (ttl {}s)", key, ttl.toSeconds());
    }

    @Override
    public void release(IdempotencyKey key) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }

        Entry[] released = new Entry[1];
        store.computeIfPresent(key, (k, existing) -> {
            if (existing.record.isCompleted()) {
                return existing;
            }
            released[0] = existing;
            return null;
        });

        if (released[0] != null) {
            released[0].completion.complete(Optional.empty());
            log.debug("Released in-flight idempotency record {}", key);
        }
    }

    @Override
    public Optional<IdempotencyRecord> find(IdempotencyKey key) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        Entry entry = store.get(key);
        if (entry == null || entry.record.isExpired(clock.monotonicNanos())) {
            return Optional.empty();
        }
        return Optional.of(entry.record);
    }

    @Override
    public int purgeExpired() {
        long now = clock.monotonicNanos();
        int purged = 0;
        for (Map.Entry<IdempotencyKey, Entry> e : store.entrySet()) {
            if (e.getValue().record.isExpired(now) && store.remove(e.getKey(), e.getValue())) {
                purged++;
            }
        }
        if (purged > 0) {
            log.debug("Purged {} expired idempotency record(s)", purged);
        }
        return purged;
    }

    @Override
    public void reset() {
        List<Entry> inFlight = new ArrayList<>();
        for (IdempotencyKey key : store.keySet()) {
            Entry removed = store.remove(key);
            if (removed != null && !removed.record.isCompleted()) {
                inFlight.add(removed);
            }
        }
        inFlight.forEach(entry -> entry.completion.complete(Optional.empty()));
        log.info("Idempotency guard reset ({} in-flight waiter group(s) released)", inFlight.size());
    }

    /**
     * Returns the number of stored records, including expired ones not yet purged.
     *
     * <p>This method is useful for testing and debugging.</p>
     *
     * @return the number of records
     */
    public int size() {
        return store.size();
    }

    private static final class Entry {

        private final IdempotencyRecord record;
        private final Object fingerprint;
        private final CompletableFuture<Optional<Result<?, DispatchError>>> completion;

        private Entry(
            IdempotencyRecord record,
            Object fingerprint,
            CompletableFuture<Optional<Result<?, DispatchError>>> completion
        ) {
            this.record = record;
            this.fingerprint = fingerprint;
            this.completion = completion;
        }

        static Entry inFlight(IdempotencyRecord record, Object fingerprint) {
            return new Entry(record, fingerprint, new CompletableFuture<>());
        }

        static Entry completed(IdempotencyRecord record, Object fingerprint) {
            return new Entry(record, fingerprint, null);
        }

        boolean matches(Object other) {
            return fingerprint == null || other == null || Objects.equals(fingerprint, other);
        }
    }
}
