package com.ryuqq.dispatch.core.protection;

import java.util.Optional;
import java.util.Set;

/**
 * 이름별 독립 Circuit Breaker 레지스트리.
 *
 * <p>프로세스 전역 싱글톤이 아니라, 애플리케이션 시작 시 한 번 생성되어
 * Bus 구성에 주입되는 객체입니다. 테스트 격리를 위해 {@link #reset()}을 제공합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface CircuitBreakerRegistry {

    /**
     * 이름으로 Circuit Breaker 조회 (없으면 생성).
     *
     * <p>동일 이름에 대해 항상 같은 인스턴스를 반환해야 합니다.</p>
     *
     * @param name Circuit Breaker 이름
     * @return Circuit Breaker
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    CircuitBreaker get(String name);

    /**
     * 이름으로 Circuit Breaker 조회 (조회만).
     *
     * @param name Circuit Breaker 이름
     * @return Circuit Breaker (없으면 empty)
     */
    Optional<CircuitBreaker> find(String name);

    /**
     * 생성된 Circuit Breaker 이름 목록.
     *
     * @return 이름 집합 (불변 스냅샷)
     */
    Set<String> names();

    /**
     * 모든 Circuit Breaker를 CLOSED로 리셋.
     */
    void reset();

    /**
     * 지정한 Circuit Breaker를 CLOSED로 리셋.
     *
     * @param name Circuit Breaker 이름 (없으면 무시)
     */
    void reset(String name);
}
