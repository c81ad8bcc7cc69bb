package com.ryuqq.gatekeeper.core.protection;

/**
 * 현재 세대(generation)의 호출 집계 스냅샷.
 *
 * <p>상태 전이 또는 CLOSED 카운트 구간 만료 시 모든 값이 0으로 초기화됩니다.</p>
 *
 * <p><strong>집계 규칙:</strong></p>
 * <ul>
 *   <li>requests: 요청이 허용(admission)되는 시점에 증가</li>
 *   <li>성공: totalSuccesses, consecutiveSuccesses 증가, consecutiveFailures 초기화</li>
 *   <li>실패: totalFailures, consecutiveFailures 증가, consecutiveSuccesses 초기화</li>
 * </ul>
 *
 * @param requests 허용된 요청 수
 * @param totalSuccesses 성공 수
 * @param totalFailures 실패 수
 * @param consecutiveSuccesses 연속 성공 수
 * @param consecutiveFailures 연속 실패 수
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public record Counts(
    long requests,
    long totalSuccesses,
    long totalFailures,
    long consecutiveSuccesses,
    long consecutiveFailures
) {

    private static final Counts EMPTY = new Counts(0, 0, 0, 0, 0);

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 음수 값이 포함된 경우
     */
    public Counts {
        if (requests < 0 || totalSuccesses < 0 || totalFailures < 0
            || consecutiveSuccesses < 0 || consecutiveFailures < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
    }

    /**
     * 모든 값이 0인 스냅샷.
     *
     * @return 빈 Counts
     */
    public static Counts empty() {
        return EMPTY;
    }

    /**
     * 실패율 계산.
     *
     * @return totalFailures / requests, requests가 0이면 0.0
     */
    public double failureRatio() {
        if (requests == 0) {
            return 0.0;
        }
        return (double) totalFailures / requests;
    }
}
