package com.ryuqq.dispatch.testkit.fixture;

import com.ryuqq.dispatch.core.contract.Command;
import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.model.IdempotencyKey;

import java.time.Duration;
import java.util.Optional;

/**
 * Sample command used by contract tests.
 *
 * @param payload arbitrary payload, echoed by test handlers
 * @param key idempotency key (nullable)
 * @param ttl per-command idempotency TTL (nullable)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record TestCommand(String payload, IdempotencyKey key, Duration ttl) implements Command<String> {

    public static final MessageType TYPE = MessageType.of("test.command");

    /**
     * Creates a command without an idempotency key.
     *
     * @param payload payload
     * @return command
     */
    public static TestCommand of(String payload) {
        return new TestCommand(payload, null, null);
    }

    /**
     * Creates a command with an idempotency key.
     *
     * @param payload payload
     * @param key idempotency key value
     * @return command
     */
    public static TestCommand withKey(String payload, String key) {
        return new TestCommand(payload, IdempotencyKey.of(key), null);
    }

    @Override
    public MessageType type() {
        return TYPE;
    }

    @Override
    public Optional<IdempotencyKey> idempotencyKey() {
        return Optional.ofNullable(key);
    }

    @Override
    public Optional<Duration> idempotencyTtl() {
        return Optional.ofNullable(ttl);
    }
}
