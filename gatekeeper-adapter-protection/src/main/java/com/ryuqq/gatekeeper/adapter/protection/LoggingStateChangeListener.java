package com.ryuqq.gatekeeper.adapter.protection;

import com.ryuqq.gatekeeper.core.protection.CircuitBreakerState;
import com.ryuqq.gatekeeper.core.protection.event.StateChangeEvent;
import com.ryuqq.gatekeeper.core.protection.event.StateChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 상태 전이를 SLF4J로 기록하는 리스너.
 *
 * <p>OPEN 진입은 WARN, 나머지 전이는 INFO 레벨로 기록합니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class LoggingStateChangeListener implements StateChangeListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingStateChangeListener.class);

    @Override
    public void onStateChange(StateChangeEvent event) {
        if (event.to() == CircuitBreakerState.OPEN) {
            log.warn("Circuit breaker {} opened: {} → {} (generation: {})",
                event.breakerName(), event.from(), event.to(), event.generation());
            return;
        }
        log.info("Circuit breaker {} changed state: {} → {} (generation: {})",
            event.breakerName(), event.from(), event.to(), event.generation());
    }
}
