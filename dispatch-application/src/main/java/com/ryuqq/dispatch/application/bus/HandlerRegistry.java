package com.ryuqq.dispatch.application.bus;

import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.error.DuplicateHandlerException;
import com.ryuqq.dispatch.core.handler.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 메시지 타입별 Handler 레지스트리.
 *
 * <p>설정 단계에서만 등록되고, 첫 dispatch 시점에 봉인(seal)되어 이후에는 읽기 전용입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>메시지 타입당 정확히 하나의 Handler</li>
 *   <li>중복 등록은 등록 시점에 {@link DuplicateHandlerException}</li>
 *   <li>봉인 이후 등록은 {@link IllegalStateException}</li>
 * </ul>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<MessageType, Handler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final AtomicBoolean sealed = new AtomicBoolean(false);
    private final String name;

    /**
     * HandlerRegistry 생성.
     *
     * @param name 로그 식별용 이름 (예: command, query)
     */
    public HandlerRegistry(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * Handler 등록.
     *
     * @param type 메시지 타입
     * @param handler Handler
     * @throws IllegalArgumentException type 또는 handler가 null인 경우
     * @throws DuplicateHandlerException 이미 등록된 타입인 경우
     * @throws IllegalStateException 레지스트리가 봉인된 경우
     */
    public void register(MessageType type, Handler<?, ?> handler) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (sealed.get()) {
            throw new IllegalStateException(
                "Cannot register handler for " + type.getValue() + " after the " + name + " bus started dispatching"
            );
        }
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new DuplicateHandlerException(type);
        }
        log.debug("Registered {} handler for {}", name, type.getValue());
    }

    /**
     * 레지스트리 봉인 (최초 1회만 효과).
     */
    public void seal() {
        if (sealed.compareAndSet(false, true)) {
            log.info("{} handler registry sealed with {} handler(s)", name, handlers.size());
        }
    }

    /**
     * Handler 조회.
     *
     * @param type 메시지 타입
     * @return Handler (없으면 empty)
     */
    public Optional<Handler<?, ?>> find(MessageType type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(type));
    }

    /**
     * 등록 여부 확인.
     *
     * @param type 메시지 타입
     * @return 등록 여부
     */
    public boolean isRegistered(MessageType type) {
        return type != null && handlers.containsKey(type);
    }

    /**
     * 등록된 메시지 타입 목록.
     *
     * @return 불변 스냅샷
     */
    public Set<MessageType> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * 봉인 여부 확인.
     *
     * @return 봉인 여부
     */
    public boolean isSealed() {
        return sealed.get();
    }
}
