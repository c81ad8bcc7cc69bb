package com.ryuqq.gatekeeper.testkit.transport;

import com.ryuqq.gatekeeper.adapter.http.Transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 기대 요청 목록을 순서대로 검증하고, 미리 정한 응답 또는 예외를 돌려주는 테스트용 Transport.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ScriptedTransport transport = new ScriptedTransport();
 * transport.expect("GET", URI.create("https://api.example.com/items/1"))
 *     .willReturn(200, "{\"id\":1}");
 * transport.expect("GET", null)
 *     .willThrow(new ConnectException("connection refused"));
 * }</pre>
 *
 * <ul>
 *   <li>method, uri가 null이면 해당 항목은 검증하지 않음</li>
 *   <li>기대 요청이 없거나 일치하지 않으면 {@link IOException}</li>
 * </ul>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class ScriptedTransport implements Transport {

    private final Queue<Expectation> expectations = new ConcurrentLinkedQueue<>();
    private final List<HttpRequest> receivedRequests = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger callCount = new AtomicInteger();

    /**
     * 기대 요청 등록.
     *
     * @param method HTTP 메서드 (null이면 검증 안 함)
     * @param uri 요청 URI (null이면 검증 안 함)
     * @return 응답을 지정할 Expectation
     */
    public Expectation expect(String method, URI uri) {
        Expectation expectation = new Expectation(method, uri);
        expectations.add(expectation);
        return expectation;
    }

    @Override
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
        throws IOException, InterruptedException {
        callCount.incrementAndGet();
        receivedRequests.add(request);

        Expectation next = expectations.poll();
        if (next == null) {
            throw new IOException("Unexpected request: " + request.method() + " " + request.uri());
        }
        if (next.method != null && !next.method.equalsIgnoreCase(request.method())) {
            throw new IOException("Expected method " + next.method + ", got " + request.method());
        }
        if (next.uri != null && !next.uri.equals(request.uri())) {
            throw new IOException("Expected uri " + next.uri + ", got " + request.uri());
        }
        if (next.failure != null) {
            throw next.failure;
        }
        return next.toResponse(request, bodyHandler);
    }

    /**
     * send() 호출 횟수.
     */
    public int getCallCount() {
        return callCount.get();
    }

    /**
     * 받은 요청 목록 (호출 순서).
     */
    public List<HttpRequest> getReceivedRequests() {
        synchronized (receivedRequests) {
            return List.copyOf(receivedRequests);
        }
    }

    /**
     * 소비되지 않은 기대 요청 수.
     */
    public int remainingExpectations() {
        return expectations.size();
    }

    public void reset() {
        expectations.clear();
        receivedRequests.clear();
        callCount.set(0);
    }

    /**
     * 기대 요청 하나와 그 응답.
     */
    public static final class Expectation {

        private final String method;
        private final URI uri;
        private int status = 200;
        private String body = "";
        private Map<String, List<String>> headers = Map.of();
        private IOException failure;

        private Expectation(String method, URI uri) {
            this.method = method;
            this.uri = uri;
        }

        public Expectation willReturn(int status, String body) {
            this.status = status;
            this.body = body != null ? body : "";
            return this;
        }

        public Expectation withHeaders(Map<String, List<String>> headers) {
            this.headers = Map.copyOf(headers);
            return this;
        }

        public Expectation willThrow(IOException failure) {
            this.failure = failure;
            return this;
        }

        private <T> HttpResponse<T> toResponse(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
            throws IOException {
            HttpHeaders httpHeaders = HttpHeaders.of(headers, (name, value) -> true);
            HttpResponse.ResponseInfo info = new HttpResponse.ResponseInfo() {
                @Override
                public int statusCode() {
                    return status;
                }

                @Override
                public HttpHeaders headers() {
                    return httpHeaders;
                }

                @Override
                public java.net.http.HttpClient.Version version() {
                    return java.net.http.HttpClient.Version.HTTP_1_1;
                }
            };

            HttpResponse.BodySubscriber<T> subscriber = bodyHandler.apply(info);
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    // 본문은 한 번에 전달
                }

                @Override
                public void cancel() {
                    // 취소할 자원 없음
                }
            });
            subscriber.onNext(List.of(ByteBuffer.wrap(body.getBytes(StandardCharsets.UTF_8))));
            subscriber.onComplete();

            try {
                T converted = subscriber.getBody().toCompletableFuture().join();
                return new ScriptedResponse<>(status, request, httpHeaders, converted);
            } catch (CompletionException e) {
                throw new IOException("Failed to convert scripted body", e.getCause());
            }
        }
    }
}
