package com.ryuqq.gatekeeper.adapter.http;

import com.ryuqq.gatekeeper.adapter.protection.GenerationalCircuitBreaker;
import com.ryuqq.gatekeeper.core.protection.CircuitBreaker;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Circuit Breaker를 적용한 Transport 데코레이터.
 *
 * <p>모든 요청은 {@link CircuitBreaker#execute}를 통해 하위 Transport로 전달됩니다.</p>
 *
 * <ul>
 *   <li>허용: 하위 Transport의 응답과 예외를 그대로 반환</li>
 *   <li>차단: 하위 Transport를 호출하지 않고 {@link CircuitBreakerOpenException}</li>
 *   <li>재시도하지 않음 (호출자 책임)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 기본 설정은 모든 예외를 실패로 집계하므로, 호출 스레드가 인터럽트되어 발생한
 * {@link InterruptedException}도 하위 서비스 장애처럼 집계되어 차단을 앞당길 수 있습니다.
 * 호출자 취소를 집계에서 빼려면 제외 predicate를 지정합니다:</p>
 * <pre>{@code
 * CircuitBreakerTransportOptions options = CircuitBreakerTransportOptions.defaults();
 * options = options.withConfig(
 *     options.config().withIgnoreExceptionPredicate(InterruptedException.class::isInstance));
 * }</pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class CircuitBreakerTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerTransport.class);

    private final Transport base;
    private final CircuitBreaker circuitBreaker;

    /**
     * 기본 Transport, 기본 옵션으로 생성.
     */
    public CircuitBreakerTransport() {
        this(null, (CircuitBreakerTransportOptions) null);
    }

    /**
     * 옵션으로 Circuit Breaker를 생성하여 적용.
     *
     * @param base 하위 Transport (null이면 {@link HttpClientTransport#defaultTransport()})
     * @param options 옵션 (null이면 {@link CircuitBreakerTransportOptions#defaults()})
     */
    public CircuitBreakerTransport(Transport base, CircuitBreakerTransportOptions options) {
        CircuitBreakerTransportOptions resolved = options != null ? options : CircuitBreakerTransportOptions.defaults();
        this.base = resolveBase(base);
        this.circuitBreaker = new GenerationalCircuitBreaker(resolved.config(), resolved.clock(), resolved.listeners());
    }

    /**
     * 이미 구성된 Circuit Breaker를 적용.
     *
     * @param base 하위 Transport (null이면 {@link HttpClientTransport#defaultTransport()})
     * @param circuitBreaker Circuit Breaker
     * @throws IllegalArgumentException circuitBreaker가 null인 경우
     */
    public CircuitBreakerTransport(Transport base, CircuitBreaker circuitBreaker) {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        this.base = resolveBase(base);
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * 요청 실행.
     *
     * @throws CircuitBreakerOpenException Circuit Breaker가 호출을 차단한 경우
     * @throws IOException 하위 Transport의 네트워크 오류
     * @throws InterruptedException 하위 Transport 대기 중 인터럽트
     */
    @Override
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
        throws IOException, InterruptedException {
        try {
            return circuitBreaker.execute(() -> base.send(request, bodyHandler));
        } catch (IOException | InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // Transport.send가 선언하지 않은 checked 예외
            log.warn("Unexpected checked exception from transport {}: {}", base.getClass().getSimpleName(), e.toString());
            throw new IOException("Unexpected exception from transport", e);
        }
    }

    private static Transport resolveBase(Transport base) {
        if (base != null) {
            return base;
        }
        log.debug("No base transport given, using default HttpClientTransport");
        return HttpClientTransport.defaultTransport();
    }

    public Transport getBase() {
        return base;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
