package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.ValidationError;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.validation.Validator;
import com.ryuqq.dispatch.core.validation.Validators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 검증 단계.
 *
 * <p>모든 메시지에 적용되는 공통 Validator와, 메시지 타입별 Validator를 순서대로 실행합니다.
 * 실패하면 {@code next}를 호출하지 않고 {@link ValidationError}를 반환하므로,
 * 재시도 예산을 소비하거나 Circuit Breaker에 집계되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ValidationMiddleware validation = new ValidationMiddleware(
 *     Validators.valid(),
 *     Map.of(PlaceOrder.TYPE, List.of(amountValidator, currencyValidator)),
 *     false
 * );
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class ValidationMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(ValidationMiddleware.class);

    private final Validator common;
    private final Map<MessageType, Validator> byType;

    /**
     * 공통 Validator만으로 생성.
     *
     * @param validator 모든 메시지에 적용할 Validator
     */
    public ValidationMiddleware(Validator validator) {
        this(validator, Map.of(), false);
    }

    /**
     * ValidationMiddleware 생성.
     *
     * @param common 모든 메시지에 적용할 Validator
     * @param byType 메시지 타입별 Validator 목록
     * @param failFast true이면 첫 실패에서 중단, false이면 모든 위반을 수집
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ValidationMiddleware(Validator common, Map<MessageType, List<Validator>> byType, boolean failFast) {
        if (common == null) {
            throw new IllegalArgumentException("common validator cannot be null");
        }
        if (byType == null) {
            throw new IllegalArgumentException("byType cannot be null");
        }
        this.common = common;
        this.byType = compose(byType, common, failFast);
    }

    @Override
    public <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next) {
        Validator validator = byType.getOrDefault(message.type(), common);
        Result<Void, ValidationError> verdict = validator.validate(message);
        if (verdict == null) {
            throw new IllegalStateException("Validator returned null for " + message.type().getValue());
        }
        if (verdict.isErr()) {
            ValidationError error = verdict.unwrapErr();
            log.debug("Validation failed for {}: {} ({} violation(s))",
                message.type(), error.message(), error.violations().size());
            return Result.err(error);
        }
        log.debug("Validation passed for {}", message.type());
        return next.proceed(message);
    }

    private static Map<MessageType, Validator> compose(
        Map<MessageType, List<Validator>> byType,
        Validator common,
        boolean failFast
    ) {
        return byType.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(
                Map.Entry::getKey,
                entry -> Validators.composite(failFast, withCommon(common, entry.getValue()))
            ));
    }

    private static List<Validator> withCommon(Validator common, List<Validator> validators) {
        List<Validator> all = new ArrayList<>(validators.size() + 1);
        all.add(common);
        all.addAll(validators);
        return all;
    }
}
