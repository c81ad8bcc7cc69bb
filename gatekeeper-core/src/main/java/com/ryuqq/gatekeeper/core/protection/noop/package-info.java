/**
 * NoOp (No Operation) Circuit Breaker 구현.
 *
 * <p>모든 요청을 허용하고 집계하지 않습니다. 보호 없이 빠르게 실행해야 하는
 * 개발/테스트 환경에서 사용합니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.gatekeeper.core.protection.noop;
