package com.ryuqq.gatekeeper.core.protection;

import com.ryuqq.gatekeeper.core.model.BreakerName;

/**
 * Circuit Breaker가 호출을 차단했을 때 발생하는 예외.
 *
 * <p>실제 작업은 호출되지 않았으며, 하위 시스템의 일시적 사용 불가를 의미합니다.
 * 작업 자체가 던진 예외와 구분되어야 하며, HTTP 경계에서는 보통 503으로 매핑됩니다.</p>
 *
 * <ul>
 *   <li>OPEN: openTimeout이 아직 경과하지 않음</li>
 *   <li>HALF_OPEN: probe 허용량(maxHalfOpenRequests) 소진</li>
 * </ul>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final BreakerName breakerName;
    private final CircuitBreakerState state;

    /**
     * 생성자.
     *
     * @param breakerName 차단한 Circuit Breaker 이름
     * @param state 차단 시점 상태 (OPEN 또는 HALF_OPEN)
     * @throws IllegalArgumentException breakerName이 null이거나 state가 CLOSED/null인 경우
     */
    public CircuitBreakerOpenException(BreakerName breakerName, CircuitBreakerState state) {
        super(buildMessage(breakerName, state));
        this.breakerName = breakerName;
        this.state = state;
    }

    private static String buildMessage(BreakerName breakerName, CircuitBreakerState state) {
        if (breakerName == null) {
            throw new IllegalArgumentException("breakerName cannot be null");
        }
        if (state == null || state == CircuitBreakerState.CLOSED) {
            throw new IllegalArgumentException("state must be OPEN or HALF_OPEN (current: " + state + ")");
        }
        if (state == CircuitBreakerState.HALF_OPEN) {
            return "circuit breaker '" + breakerName + "' is HALF_OPEN: too many requests";
        }
        return "circuit breaker '" + breakerName + "' is OPEN";
    }

    public BreakerName getBreakerName() {
        return breakerName;
    }

    public CircuitBreakerState getState() {
        return state;
    }
}
