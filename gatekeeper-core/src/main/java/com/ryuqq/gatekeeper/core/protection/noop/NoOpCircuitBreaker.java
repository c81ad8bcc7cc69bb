package com.ryuqq.gatekeeper.core.protection.noop;

import com.ryuqq.gatekeeper.core.protection.CircuitBreaker;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerState;
import com.ryuqq.gatekeeper.core.protection.Counts;
import com.ryuqq.gatekeeper.core.protection.Permit;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 개발 및 테스트 환경에서 사용하거나, 보호 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 작업을 그대로 실행</li>
 *   <li>tryAcquirePermit(): 항상 Permit 발급, 보고는 무시</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>getCounts(): 항상 빈 Counts 반환</li>
 * </ul>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final String NAME = "noop";

    private static final Permit NOOP_PERMIT = new Permit() {
        @Override
        public long generation() {
            return 0;
        }

        @Override
        public void onSuccess() {
            // NoOp
        }

        @Override
        public void onFailure(Throwable cause) {
            // NoOp
        }

        @Override
        public void onIgnored() {
            // NoOp
        }
    };

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public <T> T execute(Callable<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return operation.call();
    }

    @Override
    public <T> T executeSupplier(Supplier<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return operation.get();
    }

    @Override
    public Permit tryAcquirePermit() {
        return NOOP_PERMIT;
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public Counts getCounts() {
        return Counts.empty();
    }
}
