/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>외부 호출 시 발생할 수 있는 장애를 격리하기 위한 Circuit Breaker 확장점을 정의합니다.
 * Circuit Breaker는 호출을 허용할지 결정하고, 결과를 집계해 상태를 전이시킵니다.</p>
 *
 * <h2>호출 흐름</h2>
 * <pre>
 * 1. tryAcquirePermit()  → 상태/세대 확인 (짧은 잠금), 차단 시 CircuitBreakerOpenException
 * 2. operation.call()    → 실제 작업 실행 (잠금 밖)
 * 3. OutcomeClassifier   → SUCCESS / FAILURE / IGNORED 분류
 * 4. Permit 보고         → 발급 세대가 현재 세대와 같을 때만 집계
 * 5. 상태 전이 평가      → TripPolicy (CLOSED), probe 판정 (HALF_OPEN)
 * </pre>
 *
 * <h2>시간 기반 전이</h2>
 *
 * <p>백그라운드 타이머가 없습니다. OPEN → HALF_OPEN 전이와 CLOSED 집계 구간 초기화는
 * 다음 호출(또는 상태 조회) 시점에 평가됩니다. 호출이 없는 동안에는
 * 상태가 오래된 것처럼 보일 수 있습니다.</p>
 *
 * <h2>구현</h2>
 * <ul>
 *   <li>{@code noop}: 항상 허용, 집계 없음 (개발/테스트용)</li>
 *   <li>{@code GenerationalCircuitBreaker} (adapter-protection 모듈): 세대 기반 구현</li>
 * </ul>
 *
 * <h2>사용 예시</h2>
 * <pre>{@code
 * CircuitBreakerConfig config = new CircuitBreakerConfig()
 *     .withName("inventory-api")
 *     .withOpenTimeout(Duration.ofSeconds(30));
 *
 * CircuitBreaker cb = new GenerationalCircuitBreaker(config);
 * Stock stock = cb.execute(() -> inventoryClient.fetch(sku));
 * }</pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 * @see com.ryuqq.gatekeeper.core.protection.CircuitBreaker
 * @see com.ryuqq.gatekeeper.core.protection.CircuitBreakerConfig
 * @see com.ryuqq.gatekeeper.core.protection.noop
 */
package com.ryuqq.gatekeeper.core.protection;
