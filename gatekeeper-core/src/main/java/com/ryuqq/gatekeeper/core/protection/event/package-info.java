/**
 * 상태 전이 이벤트와 리스너.
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.gatekeeper.core.protection.event;
