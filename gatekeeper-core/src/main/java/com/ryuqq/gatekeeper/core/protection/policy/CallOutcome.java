package com.ryuqq.gatekeeper.core.protection.policy;

/**
 * 작업 결과 분류.
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public enum CallOutcome {

    /** 성공으로 집계. */
    SUCCESS,

    /** 실패로 집계. */
    FAILURE,

    /** 집계 제외 (허용 시 증가한 requests를 되돌림). */
    IGNORED
}
