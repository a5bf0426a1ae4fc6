package com.ryuqq.dispatch.core.validation;

import com.ryuqq.dispatch.core.error.ValidationError;
import com.ryuqq.dispatch.core.error.Violation;
import com.ryuqq.dispatch.core.result.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * {@link Validator} 조합 유틸리티.
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class Validators {

    private static final Validator VALID = message -> Result.ok(null);

    private Validators() {
    }

    /**
     * 항상 통과하는 Validator.
     *
     * @return Validator
     */
    public static Validator valid() {
        return VALID;
    }

    /**
     * 모든 Validator의 위반을 모으는 복합 Validator.
     *
     * @param validators 검증기 목록
     * @return 복합 Validator
     */
    public static Validator composite(Validator... validators) {
        return composite(false, List.of(validators));
    }

    /**
     * 복합 Validator.
     *
     * <p>failFast가 true이면 첫 실패를 그대로 반환하고, false이면 모든 Validator를 실행하여
     * 위반 목록을 하나의 {@link ValidationError}로 합칩니다.</p>
     *
     * @param failFast 첫 실패에서 중단 여부
     * @param validators 검증기 목록 (순서대로 실행)
     * @return 복합 Validator
     * @throws IllegalArgumentException validators가 null이거나 null 요소를 포함하는 경우
     */
    public static Validator composite(boolean failFast, List<Validator> validators) {
        if (validators == null || validators.contains(null)) {
            throw new IllegalArgumentException("validators cannot be null or contain null");
        }
        List<Validator> ordered = List.copyOf(validators);

        return message -> {
            List<ValidationError> errors = new ArrayList<>();
            for (Validator validator : ordered) {
                Result<Void, ValidationError> result = validator.validate(message);
                if (result.isErr()) {
                    if (failFast) {
                        return result;
                    }
                    errors.add(result.unwrapErr());
                }
            }
            if (errors.isEmpty()) {
                return Result.ok(null);
            }
            if (errors.size() == 1) {
                return Result.err(errors.get(0));
            }
            return Result.err(merge(errors));
        };
    }

    private static ValidationError merge(List<ValidationError> errors) {
        List<Violation> violations = new ArrayList<>();
        StringJoiner messages = new StringJoiner("; ");
        for (ValidationError error : errors) {
            violations.addAll(error.violations());
            messages.add(error.message());
        }
        return new ValidationError(messages.toString(), violations);
    }
}
