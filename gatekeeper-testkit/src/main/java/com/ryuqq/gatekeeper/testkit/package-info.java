/**
 * Test kit for Gatekeeper users and implementers.
 *
 * <ul>
 *   <li>{@code clock.MutableClock}: manual clock for time-based transitions</li>
 *   <li>{@code transport.ScriptedTransport}: scripted outbound HTTP double</li>
 *   <li>{@code contract.AbstractCircuitBreakerContractTest}: contract suite for CircuitBreaker implementations</li>
 * </ul>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.gatekeeper.testkit;
