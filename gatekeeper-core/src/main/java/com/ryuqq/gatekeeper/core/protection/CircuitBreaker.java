package com.ryuqq.gatekeeper.core.protection;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>외부 호출의 실패율을 추적하고, 임계값 초과 시 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 실패율 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 제한된 요청으로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>차단 시 작업을 호출하지 않고 {@link CircuitBreakerOpenException}을 던집니다.</li>
 *   <li>허용 시 작업을 정확히 한 번, 호출 스레드에서 동기 실행합니다.</li>
 *   <li>작업의 반환값과 예외는 그대로 전달합니다 (재시도, 래핑 없음).</li>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = new GenerationalCircuitBreaker(new CircuitBreakerConfig());
 *
 * try {
 *     Quote quote = cb.execute(() -> pricingApi.fetchQuote(sku));
 * } catch (CircuitBreakerOpenException e) {
 *     // 하위 시스템 일시 사용 불가 (503)
 * }
 * }</pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름.
     *
     * @return 이름 문자열
     */
    String getName();

    /**
     * 작업 실행.
     *
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return 작업의 반환값 (변경 없음)
     * @throws CircuitBreakerOpenException 호출이 차단된 경우 (작업은 실행되지 않음)
     * @throws Exception 작업이 던진 예외 (변경 없음)
     */
    <T> T execute(Callable<T> operation) throws Exception;

    /**
     * unchecked 작업 실행.
     *
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return 작업의 반환값
     * @throws CircuitBreakerOpenException 호출이 차단된 경우
     */
    <T> T executeSupplier(Supplier<T> operation);

    /**
     * 2단계 API: 통과 허가 요청.
     *
     * <p>반환된 {@link Permit}으로 결과를 직접 보고해야 합니다.</p>
     *
     * @return 발급된 Permit
     * @throws CircuitBreakerOpenException 호출이 차단된 경우
     */
    Permit tryAcquirePermit();

    /**
     * 현재 상태 조회.
     *
     * <p>openTimeout 경과 등 지연된 시간 기반 전이는 조회 시점에 반영됩니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 세대의 집계 스냅샷 조회.
     *
     * @return Counts
     */
    Counts getCounts();
}
