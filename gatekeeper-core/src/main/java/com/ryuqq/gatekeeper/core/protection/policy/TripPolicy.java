package com.ryuqq.gatekeeper.core.protection.policy;

import com.ryuqq.gatekeeper.core.protection.Counts;

/**
 * CLOSED → OPEN 전이 조건.
 *
 * <p>CLOSED 상태에서 실패가 기록될 때마다 현재 세대의 {@link Counts}로 평가됩니다.
 * 구현은 부수효과가 없어야 하며, Circuit Breaker 잠금 안에서 호출되므로 빠르게 반환해야 합니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 * @see TripPolicies
 */
@FunctionalInterface
public interface TripPolicy {

    /**
     * OPEN으로 전이할지 결정.
     *
     * @param counts 현재 세대 집계
     * @return true: OPEN으로 전이
     */
    boolean shouldTrip(Counts counts);
}
