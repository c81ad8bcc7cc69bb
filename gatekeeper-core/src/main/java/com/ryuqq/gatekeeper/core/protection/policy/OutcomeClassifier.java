package com.ryuqq.gatekeeper.core.protection.policy;

import com.ryuqq.gatekeeper.core.protection.CircuitBreakerConfig;

import java.util.function.Predicate;

/**
 * 작업 결과를 {@link CallOutcome}으로 분류.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>예외 발생 + ignoreExceptionPredicate 일치 → IGNORED</li>
 *   <li>예외 발생 + recordFailurePredicate 일치 → FAILURE, 불일치 → SUCCESS</li>
 *   <li>정상 반환 + recordResultPredicate 일치 → FAILURE, 불일치 → SUCCESS</li>
 * </ol>
 *
 * <p>기본 설정에서는 모든 예외가 실패, 모든 정상 반환이 성공입니다.
 * 예를 들어 HTTP 5xx 응답도 예외가 아니므로 성공으로 집계됩니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class OutcomeClassifier {

    private final Predicate<Throwable> recordFailurePredicate;
    private final Predicate<Throwable> ignoreExceptionPredicate;
    private final Predicate<Object> recordResultPredicate;

    /**
     * 생성자.
     *
     * @param recordFailurePredicate 예외를 실패로 집계할지 여부
     * @param ignoreExceptionPredicate 예외를 집계에서 제외할지 여부
     * @param recordResultPredicate 반환값을 실패로 집계할지 여부 (null 반환값도 전달됨)
     * @throws IllegalArgumentException predicate가 null인 경우
     */
    public OutcomeClassifier(
        Predicate<Throwable> recordFailurePredicate,
        Predicate<Throwable> ignoreExceptionPredicate,
        Predicate<Object> recordResultPredicate
    ) {
        if (recordFailurePredicate == null) {
            throw new IllegalArgumentException("recordFailurePredicate cannot be null");
        }
        if (ignoreExceptionPredicate == null) {
            throw new IllegalArgumentException("ignoreExceptionPredicate cannot be null");
        }
        if (recordResultPredicate == null) {
            throw new IllegalArgumentException("recordResultPredicate cannot be null");
        }
        this.recordFailurePredicate = recordFailurePredicate;
        this.ignoreExceptionPredicate = ignoreExceptionPredicate;
        this.recordResultPredicate = recordResultPredicate;
    }

    /**
     * 설정으로부터 생성.
     *
     * @param config Circuit Breaker 설정
     * @return OutcomeClassifier
     */
    public static OutcomeClassifier from(CircuitBreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new OutcomeClassifier(
            config.recordFailurePredicate(),
            config.ignoreExceptionPredicate(),
            config.recordResultPredicate()
        );
    }

    /**
     * 결과 분류.
     *
     * @param result 작업 반환값 (예외 발생 시 무시)
     * @param error 작업이 던진 예외 (정상 반환 시 null)
     * @return 분류 결과
     */
    public CallOutcome classify(Object result, Throwable error) {
        if (error != null) {
            if (ignoreExceptionPredicate.test(error)) {
                return CallOutcome.IGNORED;
            }
            return recordFailurePredicate.test(error) ? CallOutcome.FAILURE : CallOutcome.SUCCESS;
        }
        return recordResultPredicate.test(result) ? CallOutcome.FAILURE : CallOutcome.SUCCESS;
    }
}
