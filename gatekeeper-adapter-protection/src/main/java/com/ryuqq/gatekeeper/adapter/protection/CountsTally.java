package com.ryuqq.gatekeeper.adapter.protection;

import com.ryuqq.gatekeeper.core.protection.Counts;

/**
 * 세대 단위 가변 집계.
 *
 * <p>thread-safe하지 않습니다. {@link GenerationalCircuitBreaker}의 잠금 안에서만 사용합니다.</p>
 */
final class CountsTally {

    private long requests;
    private long totalSuccesses;
    private long totalFailures;
    private long consecutiveSuccesses;
    private long consecutiveFailures;

    void onRequest() {
        requests++;
    }

    void onSuccess() {
        totalSuccesses++;
        consecutiveSuccesses++;
        consecutiveFailures = 0;
    }

    void onFailure() {
        totalFailures++;
        consecutiveFailures++;
        consecutiveSuccesses = 0;
    }

    void onExclusion() {
        if (requests > 0) {
            requests--;
        }
    }

    void clear() {
        requests = 0;
        totalSuccesses = 0;
        totalFailures = 0;
        consecutiveSuccesses = 0;
        consecutiveFailures = 0;
    }

    long requests() {
        return requests;
    }

    long consecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    Counts snapshot() {
        return new Counts(requests, totalSuccesses, totalFailures, consecutiveSuccesses, consecutiveFailures);
    }
}
