package com.ryuqq.gatekeeper.adapter.http;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Outbound HTTP 전송 SPI.
 *
 * <p>HTTP 요청 하나를 실행하고 응답을 반환합니다. 데코레이터(Circuit Breaker, 타임아웃 등)는
 * 다른 Transport를 감싸는 방식으로 조합됩니다.</p>
 *
 * <pre>{@code
 * Transport transport = new CircuitBreakerTransport(
 *     new TimeoutTransport(HttpClientTransport.defaultTransport(), Duration.ofSeconds(3)),
 *     CircuitBreakerTransportOptions.defaults()
 * );
 * HttpResponse<String> response = transport.send(request, HttpResponse.BodyHandlers.ofString());
 * }</pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Transport {

    /**
     * 요청 실행.
     *
     * @param request HTTP 요청
     * @param bodyHandler 응답 본문 처리기
     * @param <T> 응답 본문 타입
     * @return HTTP 응답 (상태 코드와 무관하게 정상 반환)
     * @throws IOException 네트워크 오류
     * @throws InterruptedException 대기 중 인터럽트
     */
    <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
        throws IOException, InterruptedException;
}
