/**
 * Trip 조건과 결과 분류 정책.
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.gatekeeper.core.protection.policy;
