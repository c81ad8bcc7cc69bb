package com.ryuqq.gatekeeper.adapter.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * JDK {@link HttpClient} 기반 Transport.
 *
 * <p>데코레이터에 하위 Transport가 주어지지 않으면 {@link #defaultTransport()}가 사용됩니다.
 * 기본 인스턴스는 공유 HttpClient 하나를 감싸며 상태를 변경할 수 없습니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class HttpClientTransport implements Transport {

    private final HttpClient client;

    /**
     * 생성자.
     *
     * @param client JDK HttpClient
     * @throws IllegalArgumentException client가 null인 경우
     */
    public HttpClientTransport(HttpClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    /**
     * 프로세스 공용 기본 Transport.
     *
     * @return 기본 HttpClientTransport
     */
    public static HttpClientTransport defaultTransport() {
        return DefaultHolder.INSTANCE;
    }

    @Override
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
        throws IOException, InterruptedException {
        return client.send(request, bodyHandler);
    }

    public HttpClient getClient() {
        return client;
    }

    private static final class DefaultHolder {
        private static final HttpClientTransport INSTANCE = new HttpClientTransport(HttpClient.newHttpClient());
    }
}
