package com.ryuqq.dispatch.application.pipeline;

/**
 * 동일 키의 Command가 실행 중일 때의 처리 정책.
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public enum DuplicatePolicy {

    /**
     * 실행 중인 호출이 끝날 때까지 대기한 뒤 그 결과를 반환 (기본값).
     */
    WAIT,

    /**
     * 즉시 ConflictError 반환.
     */
    REJECT
}
