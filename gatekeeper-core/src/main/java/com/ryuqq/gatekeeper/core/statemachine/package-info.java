/**
 * Circuit Breaker 상태 기계 규칙.
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.gatekeeper.core.statemachine;
