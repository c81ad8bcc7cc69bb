package com.ryuqq.gatekeeper.core.statemachine;

import com.ryuqq.gatekeeper.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (trip)</li>
 *   <li>OPEN → HALF_OPEN (openTimeout 경과)</li>
 *   <li>HALF_OPEN → OPEN (probe 실패)</li>
 *   <li>HALF_OPEN → CLOSED (probe 연속 성공)</li>
 * </ul>
 *
 * <p>CLOSED → HALF_OPEN, OPEN → CLOSED 등 나머지 전이와 동일 상태로의 전이는 허용되지 않습니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class BreakerTransition {

    // Utility class - prevent instantiation
    private BreakerTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case CLOSED -> to == CircuitBreakerState.OPEN;
            case OPEN -> to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitBreakerState.OPEN || to == CircuitBreakerState.CLOSED;
        };
    }

    /**
     * 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid circuit breaker transition: %s → %s", from, to)
            );
        }
    }
}
