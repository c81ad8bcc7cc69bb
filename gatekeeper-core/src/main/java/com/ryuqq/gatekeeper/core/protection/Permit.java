package com.ryuqq.gatekeeper.core.protection;

/**
 * Circuit Breaker 통과 허가.
 *
 * <p>{@link CircuitBreaker#tryAcquirePermit()}가 발급하며, 발급 시점의 세대(generation)를 담고 있습니다.
 * 호출자는 작업이 끝난 뒤 정확히 한 번 결과를 보고해야 합니다.
 * 두 번째 이후의 보고는 무시됩니다.</p>
 *
 * <p>보고 시점에 Circuit Breaker가 이미 다른 세대로 넘어갔다면
 * 결과는 버려지고 새 세대의 집계에 영향을 주지 않습니다.</p>
 *
 * <pre>{@code
 * Permit permit = cb.tryAcquirePermit();
 * try {
 *     Response response = client.call();
 *     permit.onSuccess();
 *     return response;
 * } catch (IOException e) {
 *     permit.onFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public interface Permit {

    /**
     * 발급 시점의 세대.
     *
     * @return generation
     */
    long generation();

    /**
     * 성공 보고.
     */
    void onSuccess();

    /**
     * 실패 보고.
     *
     * @param cause 실패 원인 (결과 값으로 실패 판정된 경우 null 가능)
     */
    void onFailure(Throwable cause);

    /**
     * 집계 제외 보고.
     *
     * <p>허용 시점에 증가한 requests를 되돌리고 성공/실패 어느 쪽에도 집계하지 않습니다.</p>
     */
    void onIgnored();
}
