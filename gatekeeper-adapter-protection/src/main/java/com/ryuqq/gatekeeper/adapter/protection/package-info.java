/**
 * Protection SPI 구현 어댑터.
 *
 * <p>{@link com.ryuqq.gatekeeper.adapter.protection.GenerationalCircuitBreaker}는
 * core 모듈의 {@code CircuitBreaker} SPI를 세대 기반 상태 기계로 구현합니다.
 * 상태 전이는 {@link com.ryuqq.gatekeeper.adapter.protection.LoggingStateChangeListener}로 기록할 수 있습니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.gatekeeper.adapter.protection;
