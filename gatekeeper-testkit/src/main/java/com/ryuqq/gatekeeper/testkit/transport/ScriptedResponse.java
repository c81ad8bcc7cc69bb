package com.ryuqq.gatekeeper.testkit.transport;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * {@link ScriptedTransport}가 반환하는 HttpResponse.
 *
 * @param statusCode 상태 코드
 * @param request 원본 요청
 * @param headers 응답 헤더
 * @param body 본문 (BodyHandler로 변환된 값)
 * @param <T> 본문 타입
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public record ScriptedResponse<T>(
    int statusCode,
    HttpRequest request,
    HttpHeaders headers,
    T body
) implements HttpResponse<T> {

    @Override
    public Optional<HttpResponse<T>> previousResponse() {
        return Optional.empty();
    }

    @Override
    public Optional<SSLSession> sslSession() {
        return Optional.empty();
    }

    @Override
    public URI uri() {
        return request.uri();
    }

    @Override
    public HttpClient.Version version() {
        return HttpClient.Version.HTTP_1_1;
    }
}
