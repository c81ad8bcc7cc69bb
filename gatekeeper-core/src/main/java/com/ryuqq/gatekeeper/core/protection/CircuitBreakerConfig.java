package com.ryuqq.gatekeeper.core.protection;

import com.ryuqq.gatekeeper.core.model.BreakerName;
import com.ryuqq.gatekeeper.core.protection.policy.TripPolicies;
import com.ryuqq.gatekeeper.core.protection.policy.TripPolicy;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p>애플리케이션 구성 시점에 한 번 생성되며, 이후 변경되지 않습니다.
 * 잘못된 설정은 호출 시점이 아닌 생성 시점에 실패합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: Circuit Breaker 이름 (기본 "default")</li>
 *   <li>maxHalfOpenRequests: HALF_OPEN에서 허용하는 probe 수이자 CLOSED 복귀에 필요한 연속 성공 수 (기본 5)</li>
 *   <li>closedCountingInterval: CLOSED 상태 집계 초기화 주기, 0이면 상태 전이 시에만 초기화 (기본 60초)</li>
 *   <li>openTimeout: OPEN 상태 유지 시간 (기본 60초)</li>
 *   <li>tripPolicy: CLOSED → OPEN 조건 (기본 requests &gt;= 5 &amp;&amp; 실패율 &gt;= 0.6)</li>
 *   <li>recordFailurePredicate: 실패로 집계할 예외 (기본 모든 예외)</li>
 *   <li>ignoreExceptionPredicate: 집계에서 제외할 예외 (기본 없음)</li>
 *   <li>recordResultPredicate: 실패로 집계할 반환값 (기본 없음)</li>
 * </ul>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 * @param name Circuit Breaker 이름
 * @param maxHalfOpenRequests HALF_OPEN probe 허용량 (양수)
 * @param closedCountingInterval CLOSED 집계 주기 (0 이상)
 * @param openTimeout OPEN 유지 시간 (양수)
 * @param tripPolicy OPEN 전이 조건
 * @param recordFailurePredicate 예외 실패 판정
 * @param ignoreExceptionPredicate 예외 제외 판정
 * @param recordResultPredicate 반환값 실패 판정
 */
public record CircuitBreakerConfig(
    BreakerName name,
    int maxHalfOpenRequests,
    Duration closedCountingInterval,
    Duration openTimeout,
    TripPolicy tripPolicy,
    Predicate<Throwable> recordFailurePredicate,
    Predicate<Throwable> ignoreExceptionPredicate,
    Predicate<Object> recordResultPredicate
) {

    public static final String DEFAULT_NAME = "default";
    public static final int DEFAULT_MAX_HALF_OPEN_REQUESTS = 5;
    public static final Duration DEFAULT_CLOSED_COUNTING_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);

    private static final Predicate<Throwable> RECORD_ALL_EXCEPTIONS = throwable -> true;
    private static final Predicate<Throwable> IGNORE_NO_EXCEPTION = throwable -> false;
    private static final Predicate<Object> NO_FAILURE_RESULT = result -> false;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: name="default", maxHalfOpenRequests=5, closedCountingInterval=60s,
     * openTimeout=60s, tripPolicy={@link TripPolicies#defaultPolicy()}</p>
     */
    public CircuitBreakerConfig() {
        this(
            BreakerName.of(DEFAULT_NAME),
            DEFAULT_MAX_HALF_OPEN_REQUESTS,
            DEFAULT_CLOSED_COUNTING_INTERVAL,
            DEFAULT_OPEN_TIMEOUT,
            TripPolicies.defaultPolicy(),
            RECORD_ALL_EXCEPTIONS,
            IGNORE_NO_EXCEPTION,
            NO_FAILURE_RESULT
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (maxHalfOpenRequests <= 0) {
            throw new IllegalArgumentException(
                "maxHalfOpenRequests must be positive (current: " + maxHalfOpenRequests + ")"
            );
        }
        if (closedCountingInterval == null || closedCountingInterval.isNegative()) {
            throw new IllegalArgumentException(
                "closedCountingInterval must be zero or positive (current: " + closedCountingInterval + ")"
            );
        }
        if (openTimeout == null || openTimeout.isNegative() || openTimeout.isZero()) {
            throw new IllegalArgumentException(
                "openTimeout must be positive (current: " + openTimeout + ")"
            );
        }
        if (tripPolicy == null) {
            throw new IllegalArgumentException("tripPolicy cannot be null");
        }
        if (recordFailurePredicate == null) {
            throw new IllegalArgumentException("recordFailurePredicate cannot be null");
        }
        if (ignoreExceptionPredicate == null) {
            throw new IllegalArgumentException("ignoreExceptionPredicate cannot be null");
        }
        if (recordResultPredicate == null) {
            throw new IllegalArgumentException("recordResultPredicate cannot be null");
        }
    }

    /**
     * CLOSED 집계 주기가 설정되어 있는지 확인.
     *
     * @return closedCountingInterval이 0보다 크면 true
     */
    public boolean hasClosedCountingInterval() {
        return !closedCountingInterval.isZero();
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withName(String name) {
        return new CircuitBreakerConfig(BreakerName.of(name), maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }

    /**
     * maxHalfOpenRequests만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withMaxHalfOpenRequests(int maxHalfOpenRequests) {
        return new CircuitBreakerConfig(name, maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }

    /**
     * closedCountingInterval만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withClosedCountingInterval(Duration closedCountingInterval) {
        return new CircuitBreakerConfig(name, maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }

    /**
     * openTimeout만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerConfig(name, maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }

    /**
     * tripPolicy만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withTripPolicy(TripPolicy tripPolicy) {
        return new CircuitBreakerConfig(name, maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }

    /**
     * recordFailurePredicate만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecordFailurePredicate(Predicate<Throwable> recordFailurePredicate) {
        return new CircuitBreakerConfig(name, maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }

    /**
     * ignoreExceptionPredicate만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withIgnoreExceptionPredicate(Predicate<Throwable> ignoreExceptionPredicate) {
        return new CircuitBreakerConfig(name, maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }

    /**
     * recordResultPredicate만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecordResultPredicate(Predicate<Object> recordResultPredicate) {
        return new CircuitBreakerConfig(name, maxHalfOpenRequests, closedCountingInterval,
            openTimeout, tripPolicy, recordFailurePredicate, ignoreExceptionPredicate, recordResultPredicate);
    }
}
