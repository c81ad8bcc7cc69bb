package com.ryuqq.gatekeeper.adapter.http;

import com.ryuqq.gatekeeper.adapter.protection.LoggingStateChangeListener;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerConfig;
import com.ryuqq.gatekeeper.core.protection.event.StateChangeListener;

import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.List;

/**
 * {@link CircuitBreakerTransport} 설정 (불변 record).
 *
 * <p><strong>기본값 ({@link #defaults()}):</strong></p>
 * <ul>
 *   <li>name: "default"</li>
 *   <li>maxHalfOpenRequests: 5</li>
 *   <li>closedCountingInterval: 60초</li>
 *   <li>openTimeout: 60초</li>
 *   <li>tripPolicy: requests &gt;= 5 &amp;&amp; 실패율 &gt;= 0.6</li>
 *   <li>clock: 시스템 UTC</li>
 *   <li>listeners: {@link LoggingStateChangeListener}</li>
 * </ul>
 *
 * <p>기본 설정에서는 전송 예외만 실패로 집계되며, 4xx/5xx 응답은 성공으로 집계됩니다.
 * 5xx 응답도 실패로 집계하려면 {@link #serverErrorsAsFailures()}를 사용합니다.
 * 호출자 인터럽트({@link InterruptedException})도 기본적으로 실패로 집계됩니다. 제외하려면
 * {@code config.withIgnoreExceptionPredicate(InterruptedException.class::isInstance)}를 지정합니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 * @param config Circuit Breaker 설정
 * @param clock 시계
 * @param listeners 상태 전이 리스너
 */
public record CircuitBreakerTransportOptions(
    CircuitBreakerConfig config,
    Clock clock,
    List<StateChangeListener> listeners
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CircuitBreakerTransportOptions {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        listeners = List.copyOf(listeners);
    }

    /**
     * 기본 설정.
     *
     * @return 기본 옵션
     */
    public static CircuitBreakerTransportOptions defaults() {
        return new CircuitBreakerTransportOptions(
            new CircuitBreakerConfig(),
            Clock.systemUTC(),
            List.of(new LoggingStateChangeListener())
        );
    }

    /**
     * 5xx 응답을 실패로 집계하는 새 인스턴스 생성.
     */
    public CircuitBreakerTransportOptions serverErrorsAsFailures() {
        return withConfig(config.withRecordResultPredicate(CircuitBreakerTransportOptions::isServerError));
    }

    /**
     * config만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerTransportOptions withConfig(CircuitBreakerConfig config) {
        return new CircuitBreakerTransportOptions(config, clock, listeners);
    }

    /**
     * clock만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerTransportOptions withClock(Clock clock) {
        return new CircuitBreakerTransportOptions(config, clock, listeners);
    }

    /**
     * listeners만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerTransportOptions withListeners(List<StateChangeListener> listeners) {
        return new CircuitBreakerTransportOptions(config, clock, listeners);
    }

    static boolean isServerError(Object result) {
        if (!(result instanceof HttpResponse)) {
            return false;
        }
        int status = ((HttpResponse<?>) result).statusCode();
        return status >= 500 && status <= 599;
    }
}
