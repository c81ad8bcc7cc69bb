/**
 * Value objects shared by the protection SPI.
 *
 * <ul>
 *   <li>{@link com.ryuqq.gatekeeper.core.model.BreakerName} - Circuit Breaker identifier</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Gatekeeper Team
 */
package com.ryuqq.gatekeeper.core.model;
