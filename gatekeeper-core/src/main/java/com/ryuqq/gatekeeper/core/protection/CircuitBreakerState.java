package com.ryuqq.gatekeeper.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 외부 호출의 실패율을 추적하고,
 * 임계값 초과 시 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (TripPolicy 충족)
 * OPEN (차단)
 *   │
 *   ▼ (openTimeout 경과 후 첫 호출 시점)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► maxHalfOpenRequests 연속 성공 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며, 카운트 구간 동안 성공/실패를 집계합니다.
     * TripPolicy가 true를 반환하면 OPEN 상태로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>실제 작업을 호출하지 않고 즉시 실패합니다.
     * openTimeout이 경과한 뒤 다음 호출 시점에 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (제한된 수의 probe 요청만 통과).
     *
     * <p>probe가 한 번이라도 실패하면 OPEN, maxHalfOpenRequests 만큼 연속 성공하면 CLOSED로 전이합니다.</p>
     */
    HALF_OPEN
}
