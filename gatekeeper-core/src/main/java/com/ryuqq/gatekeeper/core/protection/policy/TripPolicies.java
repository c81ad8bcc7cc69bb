package com.ryuqq.gatekeeper.core.protection.policy;

/**
 * 기본 제공 {@link TripPolicy} 모음.
 *
 * <p><strong>제공 정책:</strong></p>
 * <ul>
 *   <li>{@link #failureRatio(long, double)}: 최소 요청 수 충족 후 실패율 임계값</li>
 *   <li>{@link #consecutiveFailures(long)}: 연속 실패 수 임계값</li>
 *   <li>{@link #minimumFailures(long, long)}: 최소 요청 수와 최소 실패 수 동시 충족</li>
 * </ul>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class TripPolicies {

    /** 기본 정책의 최소 요청 수. */
    public static final long DEFAULT_MINIMUM_REQUESTS = 5;

    /** 기본 정책의 실패율 임계값. */
    public static final double DEFAULT_FAILURE_RATIO = 0.6;

    private static final TripPolicy DEFAULT = failureRatio(DEFAULT_MINIMUM_REQUESTS, DEFAULT_FAILURE_RATIO);

    // Utility class - prevent instantiation
    private TripPolicies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 정책: requests &gt;= 5 이고 실패율 &gt;= 0.6.
     *
     * @return 기본 TripPolicy
     */
    public static TripPolicy defaultPolicy() {
        return DEFAULT;
    }

    /**
     * 실패율 정책.
     *
     * <p>requests가 minimumRequests 미만이면 실패율을 계산하지 않으므로
     * requests == 0 상태에서 나눗셈이 일어나지 않습니다.</p>
     *
     * @param minimumRequests 최소 요청 수 (1 이상)
     * @param ratio 실패율 임계값 (0.0 초과 1.0 이하)
     * @return TripPolicy
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public static TripPolicy failureRatio(long minimumRequests, double ratio) {
        if (minimumRequests < 1) {
            throw new IllegalArgumentException(
                "minimumRequests must be positive (current: " + minimumRequests + ")"
            );
        }
        if (!(ratio > 0.0 && ratio <= 1.0)) {
            throw new IllegalArgumentException(
                "ratio must be in (0.0, 1.0] (current: " + ratio + ")"
            );
        }
        return counts -> counts.requests() >= minimumRequests && counts.failureRatio() >= ratio;
    }

    /**
     * 연속 실패 정책.
     *
     * @param threshold 연속 실패 임계값 (1 이상)
     * @return TripPolicy
     * @throws IllegalArgumentException threshold가 양수가 아닌 경우
     */
    public static TripPolicy consecutiveFailures(long threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException(
                "threshold must be positive (current: " + threshold + ")"
            );
        }
        return counts -> counts.consecutiveFailures() >= threshold;
    }

    /**
     * 최소 요청 수 + 최소 실패 수 정책.
     *
     * @param minimumRequests 최소 요청 수 (1 이상)
     * @param minimumFailures 최소 실패 수 (1 이상)
     * @return TripPolicy
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public static TripPolicy minimumFailures(long minimumRequests, long minimumFailures) {
        if (minimumRequests < 1) {
            throw new IllegalArgumentException(
                "minimumRequests must be positive (current: " + minimumRequests + ")"
            );
        }
        if (minimumFailures < 1) {
            throw new IllegalArgumentException(
                "minimumFailures must be positive (current: " + minimumFailures + ")"
            );
        }
        return counts -> counts.requests() >= minimumRequests && counts.totalFailures() >= minimumFailures;
    }
}
