package com.ryuqq.dispatch.adapter.inmemory.protection;

import com.ryuqq.dispatch.core.protection.CircuitBreaker;
import com.ryuqq.dispatch.core.protection.CircuitBreakerConfig;
import com.ryuqq.dispatch.core.protection.CircuitBreakerRegistry;
import com.ryuqq.dispatch.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CircuitBreakerRegistry}.
 *
 * <p>Breakers are created lazily on first use with {@link ConcurrentHashMap#computeIfAbsent},
 * so concurrent callers asking for the same name always share one instance. A per-name
 * configuration override takes precedence over the registry default.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry(
 *     new CircuitBreakerConfig(),
 *     Map.of("payment-gateway", new CircuitBreakerConfig().withFailureThreshold(3)),
 *     Clock.system()
 * );
 *
 * CircuitBreaker breaker = registry.get("payment-gateway");
 * </pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreakerRegistry implements CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreakerRegistry.class);

    private final ConcurrentHashMap<String, InMemoryCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaults;
    private final Map<String, CircuitBreakerConfig> overrides;
    private final Clock clock;

    /**
     * Creates a registry with default configuration and the system clock.
     */
    public InMemoryCircuitBreakerRegistry() {
        this(new CircuitBreakerConfig(), Map.of(), Clock.system());
    }

    /**
     * Creates a registry with the given default configuration.
     *
     * @param defaults configuration for breakers without an override
     * @param clock monotonic time source
     */
    public InMemoryCircuitBreakerRegistry(CircuitBreakerConfig defaults, Clock clock) {
        this(defaults, Map.of(), clock);
    }

    /**
     * Creates a registry with per-name overrides.
     *
     * @param defaults configuration for breakers without an override
     * @param overrides per-name configuration
     * @param clock monotonic time source
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryCircuitBreakerRegistry(
        CircuitBreakerConfig defaults,
        Map<String, CircuitBreakerConfig> overrides,
        Clock clock
    ) {
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        if (overrides == null) {
            throw new IllegalArgumentException("overrides cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.defaults = defaults;
        this.overrides = Map.copyOf(overrides);
        this.clock = clock;
    }

    @Override
    public CircuitBreaker get(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return breakers.computeIfAbsent(name, n -> {
            CircuitBreakerConfig config = overrides.getOrDefault(n, defaults);
            log.debug("Created circuit breaker '{}' with {}", n, config);
            return new InMemoryCircuitBreaker(n, config, clock);
        });
    }

    @Override
    public Optional<CircuitBreaker> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(breakers.get(name));
    }

    @Override
    public Set<String> names() {
        return Set.copyOf(breakers.keySet());
    }

    @Override
    public void reset() {
        breakers.values().forEach(InMemoryCircuitBreaker::reset);
        log.info("Reset {} circuit breaker(s)", breakers.size());
    }

    @Override
    public void reset(String name) {
        if (name == null) {
            return;
        }
        InMemoryCircuitBreaker breaker = breakers.get(name);
        if (breaker != null) {
            breaker.reset();
            log.info("Reset circuit breaker '{}'", name);
        }
    }
}
