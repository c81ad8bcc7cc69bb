package com.ryuqq.gatekeeper.core.protection.event;

import com.ryuqq.gatekeeper.core.model.BreakerName;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerState;

import java.time.Instant;

/**
 * Circuit Breaker 상태 전이 이벤트.
 *
 * @param breakerName Circuit Breaker 이름
 * @param from 이전 상태
 * @param to 새 상태
 * @param generation 전이 후 세대
 * @param occurredAt 전이 시각
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public record StateChangeEvent(
    BreakerName breakerName,
    CircuitBreakerState from,
    CircuitBreakerState to,
    long generation,
    Instant occurredAt
) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 from == to인 경우
     */
    public StateChangeEvent {
        if (breakerName == null) {
            throw new IllegalArgumentException("breakerName cannot be null");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from == to) {
            throw new IllegalArgumentException("from and to must differ (state: " + from + ")");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
