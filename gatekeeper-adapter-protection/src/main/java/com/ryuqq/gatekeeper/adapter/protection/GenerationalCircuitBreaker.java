package com.ryuqq.gatekeeper.adapter.protection;

import com.ryuqq.gatekeeper.core.protection.CircuitBreaker;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerConfig;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerOpenException;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerState;
import com.ryuqq.gatekeeper.core.protection.Counts;
import com.ryuqq.gatekeeper.core.protection.Permit;
import com.ryuqq.gatekeeper.core.protection.event.StateChangeEvent;
import com.ryuqq.gatekeeper.core.protection.event.StateChangeListener;
import com.ryuqq.gatekeeper.core.protection.policy.CallOutcome;
import com.ryuqq.gatekeeper.core.protection.policy.OutcomeClassifier;
import com.ryuqq.gatekeeper.core.statemachine.BreakerTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 세대(generation) 기반 Circuit Breaker 구현체.
 *
 * <p>상태, 집계, 세대, 만료 시각은 하나의 {@link ReentrantLock}으로 보호됩니다.
 * 잠금은 허용 판단과 결과 기록 동안에만 잡으며, 실제 작업 실행 중에는 잡지 않습니다.</p>
 *
 * <p><strong>세대:</strong></p>
 * <ul>
 *   <li>상태 전이와 CLOSED 집계 구간 초기화마다 1씩 증가</li>
 *   <li>Permit은 발급 시점의 세대를 기억</li>
 *   <li>결과 보고 시 세대가 바뀌었으면 결과를 버림 (새 세대 집계 보호)</li>
 * </ul>
 *
 * <p><strong>상태별 동작:</strong></p>
 * <pre>
 * CLOSED    : 항상 허용. now &gt;= expiry 이면 새 세대로 집계 초기화.
 *             실패 기록 후 TripPolicy 충족 시 OPEN.
 * OPEN      : 항상 차단. now &gt;= expiry 를 관측하는 첫 호출에서 HALF_OPEN.
 * HALF_OPEN : requests &lt; maxHalfOpenRequests 인 동안만 허용.
 *             실패 1회 → OPEN, 연속 성공 maxHalfOpenRequests 회 → CLOSED.
 * </pre>
 *
 * <p>백그라운드 스레드나 타이머를 사용하지 않습니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class GenerationalCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(GenerationalCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final OutcomeClassifier classifier;
    private final Clock clock;
    private final List<StateChangeListener> listeners;
    private final ReentrantLock lock = new ReentrantLock();

    private final CountsTally counts = new CountsTally();
    private CircuitBreakerState state;
    private long generation;
    private Instant expiry;

    /**
     * 생성자 (시스템 UTC 시계, 리스너 없음).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public GenerationalCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), List.of());
    }

    /**
     * 생성자 (시계 지정).
     *
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public GenerationalCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        this(config, clock, List.of());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock 시계
     * @param listeners 상태 전이 리스너 (등록 순서대로 호출)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public GenerationalCircuitBreaker(CircuitBreakerConfig config, Clock clock, List<StateChangeListener> listeners) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        this.config = config;
        this.classifier = OutcomeClassifier.from(config);
        this.clock = clock;
        this.listeners = List.copyOf(listeners);

        this.state = CircuitBreakerState.CLOSED;
        toNewGeneration(clock.instant());
    }

    @Override
    public String getName() {
        return config.name().getValue();
    }

    /**
     * 설정 조회.
     *
     * @return 생성 시 전달된 설정
     */
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public <T> T execute(Callable<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        Permit permit = tryAcquirePermit();

        T result;
        try {
            result = operation.call();
        } catch (Throwable t) {
            report(permit, null, t);
            throw t;
        }
        report(permit, result, null);
        return result;
    }

    @Override
    public <T> T executeSupplier(Supplier<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        Permit permit = tryAcquirePermit();

        T result;
        try {
            result = operation.get();
        } catch (Throwable t) {
            report(permit, null, t);
            throw t;
        }
        report(permit, result, null);
        return result;
    }

    @Override
    public Permit tryAcquirePermit() {
        List<StateChangeEvent> events = new ArrayList<>(2);
        CircuitBreakerState refusedIn = null;
        Permit permit = null;

        lock.lock();
        try {
            advance(clock.instant(), events);

            if (state == CircuitBreakerState.OPEN) {
                refusedIn = CircuitBreakerState.OPEN;
            } else if (state == CircuitBreakerState.HALF_OPEN
                && counts.requests() >= config.maxHalfOpenRequests()) {
                refusedIn = CircuitBreakerState.HALF_OPEN;
            } else {
                counts.onRequest();
                permit = new GenerationPermit(generation);
            }
        } finally {
            lock.unlock();
        }

        publish(events);

        if (refusedIn != null) {
            log.debug("Circuit breaker {} rejected call in state {}", config.name(), refusedIn);
            throw new CircuitBreakerOpenException(config.name(), refusedIn);
        }
        return permit;
    }

    @Override
    public CircuitBreakerState getState() {
        List<StateChangeEvent> events = new ArrayList<>(1);
        CircuitBreakerState current;

        lock.lock();
        try {
            advance(clock.instant(), events);
            current = state;
        } finally {
            lock.unlock();
        }

        publish(events);
        return current;
    }

    @Override
    public Counts getCounts() {
        List<StateChangeEvent> events = new ArrayList<>(1);
        Counts snapshot;

        lock.lock();
        try {
            advance(clock.instant(), events);
            snapshot = counts.snapshot();
        } finally {
            lock.unlock();
        }

        publish(events);
        return snapshot;
    }

    /**
     * 현재 세대 조회 (관측용).
     *
     * @return generation
     */
    public long getGeneration() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 결과를 분류하여 Permit을 정산합니다.
     *
     * <p>분류 predicate가 예외를 던지면 FAILURE로 정산하고, 호출자에게는 원래 결과를 전달합니다.</p>
     */
    private void report(Permit permit, Object result, Throwable error) {
        CallOutcome outcome = CallOutcome.FAILURE;
        try {
            outcome = classifier.classify(result, error);
        } catch (RuntimeException e) {
            log.warn("Outcome classification failed for circuit breaker {}, recording as failure: {}",
                config.name(), e.toString());
        } finally {
            settlePermit(permit, outcome, error);
        }
    }

    private static void settlePermit(Permit permit, CallOutcome outcome, Throwable error) {
        switch (outcome) {
            case SUCCESS -> permit.onSuccess();
            case FAILURE -> permit.onFailure(error);
            case IGNORED -> permit.onIgnored();
        }
    }

    /**
     * 발급 세대 기준 결과 기록.
     *
     * @param permitGeneration Permit 발급 세대
     * @param outcome 분류된 결과
     */
    private void record(long permitGeneration, CallOutcome outcome) {
        List<StateChangeEvent> events = new ArrayList<>(2);

        lock.lock();
        try {
            Instant now = clock.instant();
            advance(now, events);

            if (permitGeneration != generation) {
                log.debug("Circuit breaker {} discarded {} from stale generation {} (current: {})",
                    config.name(), outcome, permitGeneration, generation);
                return;
            }

            switch (outcome) {
                case SUCCESS -> onSuccess(now, events);
                case FAILURE -> onFailure(now, events);
                case IGNORED -> counts.onExclusion();
            }
        } finally {
            lock.unlock();
            publish(events);
        }
    }

    private void onSuccess(Instant now, List<StateChangeEvent> events) {
        switch (state) {
            case CLOSED -> counts.onSuccess();
            case HALF_OPEN -> {
                counts.onSuccess();
                if (counts.consecutiveSuccesses() >= config.maxHalfOpenRequests()) {
                    transitionTo(CircuitBreakerState.CLOSED, now, events);
                }
            }
            case OPEN -> {
                // OPEN 세대에서는 Permit이 발급되지 않음
            }
        }
    }

    private void onFailure(Instant now, List<StateChangeEvent> events) {
        switch (state) {
            case CLOSED -> {
                counts.onFailure();
                if (config.tripPolicy().shouldTrip(counts.snapshot())) {
                    transitionTo(CircuitBreakerState.OPEN, now, events);
                }
            }
            case HALF_OPEN -> transitionTo(CircuitBreakerState.OPEN, now, events);
            case OPEN -> {
                // OPEN 세대에서는 Permit이 발급되지 않음
            }
        }
    }

    /**
     * 시간 기반 지연 전이 반영. 잠금 안에서만 호출.
     */
    private void advance(Instant now, List<StateChangeEvent> events) {
        switch (state) {
            case CLOSED -> {
                if (expiry != null && !now.isBefore(expiry)) {
                    toNewGeneration(now);
                }
            }
            case OPEN -> {
                if (!now.isBefore(expiry)) {
                    transitionTo(CircuitBreakerState.HALF_OPEN, now, events);
                }
            }
            case HALF_OPEN -> {
                // 만료 없음
            }
        }
    }

    private void transitionTo(CircuitBreakerState next, Instant now, List<StateChangeEvent> events) {
        if (state == next) {
            return;
        }
        BreakerTransition.validate(state, next);

        CircuitBreakerState previous = state;
        state = next;
        toNewGeneration(now);
        events.add(new StateChangeEvent(config.name(), previous, next, generation, now));
    }

    private void toNewGeneration(Instant now) {
        generation++;
        counts.clear();
        expiry = switch (state) {
            case CLOSED -> config.hasClosedCountingInterval() ? now.plus(config.closedCountingInterval()) : null;
            case OPEN -> now.plus(config.openTimeout());
            case HALF_OPEN -> null;
        };
    }

    /**
     * 리스너 통지. 잠금 밖에서만 호출.
     */
    private void publish(List<StateChangeEvent> events) {
        for (StateChangeEvent event : events) {
            for (StateChangeListener listener : listeners) {
                try {
                    listener.onStateChange(event);
                } catch (RuntimeException e) {
                    log.warn("State change listener failed for circuit breaker {}: {} → {}",
                        event.breakerName(), event.from(), event.to(), e);
                }
            }
        }
    }

    /**
     * 발급 세대를 기억하는 Permit. 첫 보고만 반영됩니다.
     */
    private final class GenerationPermit implements Permit {

        private final long generation;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        private GenerationPermit(long generation) {
            this.generation = generation;
        }

        @Override
        public long generation() {
            return generation;
        }

        @Override
        public void onSuccess() {
            settle(CallOutcome.SUCCESS);
        }

        @Override
        public void onFailure(Throwable cause) {
            settle(CallOutcome.FAILURE);
        }

        @Override
        public void onIgnored() {
            settle(CallOutcome.IGNORED);
        }

        private void settle(CallOutcome outcome) {
            if (settled.compareAndSet(false, true)) {
                record(generation, outcome);
            }
        }
    }

    @Override
    public String toString() {
        return "GenerationalCircuitBreaker{" + config.name() + '}';
    }
}
