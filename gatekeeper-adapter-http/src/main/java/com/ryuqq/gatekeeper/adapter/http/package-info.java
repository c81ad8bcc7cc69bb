/**
 * Outbound HTTP Transport 데코레이터.
 *
 * <p>{@link com.ryuqq.gatekeeper.adapter.http.Transport}를 감싸서 하나의 관심사를 추가합니다.</p>
 *
 * <h2>데코레이터 조합 순서</h2>
 * <pre>
 * 1. CircuitBreakerTransport → OPEN 상태 시 즉시 실패
 * 2. TimeoutTransport        → 요청 타임아웃 적용 (초과 시 실패로 집계)
 * 3. HttpClientTransport     → 실제 네트워크 호출
 * </pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.gatekeeper.adapter.http;
