package com.ryuqq.gatekeeper.adapter.http;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * 요청 단위 타임아웃을 적용하는 Transport 데코레이터.
 *
 * <p>요청에 더 짧은 타임아웃이 이미 설정되어 있으면 그대로 두고,
 * 없거나 더 길면 설정된 타임아웃으로 교체한 사본을 하위 Transport에 전달합니다.
 * 타임아웃 초과 시 하위 Transport가 {@link java.net.http.HttpTimeoutException}을 던집니다.</p>
 *
 * <p>Circuit Breaker 앞에 조합하면 느린 호출이 실패로 집계됩니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class TimeoutTransport implements Transport {

    private final Transport base;
    private final Duration timeout;

    /**
     * 생성자.
     *
     * @param base 하위 Transport (null이면 {@link HttpClientTransport#defaultTransport()})
     * @param timeout 요청 타임아웃 (양수)
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public TimeoutTransport(Transport base, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.base = base != null ? base : HttpClientTransport.defaultTransport();
        this.timeout = timeout;
    }

    @Override
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
        throws IOException, InterruptedException {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return base.send(withTimeout(request), bodyHandler);
    }

    private HttpRequest withTimeout(HttpRequest request) {
        Optional<Duration> current = request.timeout();
        if (current.isPresent() && current.get().compareTo(timeout) <= 0) {
            return request;
        }
        return HttpRequest.newBuilder(request, (name, value) -> true)
            .timeout(timeout)
            .build();
    }

    public Duration getTimeout() {
        return timeout;
    }
}
