package com.ryuqq.gatekeeper.core.protection.event;

/**
 * Circuit Breaker 상태 전이 리스너.
 *
 * <p>전이가 확정되고 내부 잠금이 해제된 뒤, 전이를 일으킨 호출 스레드에서 호출됩니다.
 * 리스너가 던진 예외는 호출 결과에 영향을 주지 않습니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateChangeListener {

    /**
     * 상태 전이 통지.
     *
     * @param event 전이 이벤트
     */
    void onStateChange(StateChangeEvent event);
}
