package com.ryuqq.gatekeeper.testkit.contract;

import com.ryuqq.gatekeeper.core.protection.CircuitBreaker;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerConfig;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerOpenException;
import com.ryuqq.gatekeeper.core.protection.CircuitBreakerState;
import com.ryuqq.gatekeeper.core.protection.Counts;
import com.ryuqq.gatekeeper.core.protection.Permit;
import com.ryuqq.gatekeeper.core.protection.policy.TripPolicies;
import com.ryuqq.gatekeeper.testkit.clock.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for CircuitBreaker contract tests.
 *
 * <p>Any {@link CircuitBreaker} implementation backed by a state machine should pass these
 * scenarios. Subclasses only provide the factory method.</p>
 *
 * <p><strong>Scenarios:</strong></p>
 * <ul>
 *   <li>Fail-fast: the call after the trip never reaches the operation</li>
 *   <li>Timeout recovery: a probe is admitted once openTimeout has elapsed</li>
 *   <li>HALF_OPEN: one failing probe reopens, maxHalfOpenRequests successes close</li>
 *   <li>HALF_OPEN: admissions beyond the probe budget are rejected</li>
 *   <li>Generations: outcomes from a previous generation never touch fresh counts</li>
 *   <li>Pass-through: results and exceptions are returned unchanged</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyBreakerContractTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Override
 *     protected CircuitBreaker newCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
 *         return new MyBreaker(config, clock);
 *     }
 * }
 * </pre>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    protected static final Duration OPEN_TIMEOUT = Duration.ofSeconds(10);

    protected MutableClock clock;
    protected AtomicInteger operationCalls;

    /**
     * Creates the implementation under test.
     *
     * @param config breaker configuration
     * @param clock clock the breaker must read time from
     * @return a new breaker in CLOSED state
     */
    protected abstract CircuitBreaker newCircuitBreaker(CircuitBreakerConfig config, Clock clock);

    @BeforeEach
    void setUpClock() {
        clock = MutableClock.startingAtEpochOf2024();
        operationCalls = new AtomicInteger();
    }

    /**
     * Two failures out of two requests trip; one probe closes; no counting interval.
     */
    protected CircuitBreakerConfig twoFailuresConfig() {
        return new CircuitBreakerConfig()
            .withName("contract")
            .withTripPolicy(TripPolicies.minimumFailures(2, 2))
            .withMaxHalfOpenRequests(1)
            .withClosedCountingInterval(Duration.ZERO)
            .withOpenTimeout(OPEN_TIMEOUT);
    }

    protected String succeed(CircuitBreaker cb) throws Exception {
        return cb.execute(() -> {
            operationCalls.incrementAndGet();
            return "ok";
        });
    }

    protected void fail(CircuitBreaker cb) {
        assertThatThrownBy(() -> cb.execute(() -> {
            operationCalls.incrementAndGet();
            throw new IOException("downstream failure");
        })).isInstanceOf(IOException.class);
    }

    protected void trip(CircuitBreaker cb) {
        fail(cb);
        fail(cb);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void newCircuitBreaker_StartsClosedWithEmptyCounts() {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig(), clock);

        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(cb.getCounts()).isEqualTo(Counts.empty());
        assertThat(cb.getName()).isEqualTo("contract");
    }

    @Test
    void tripped_NextCallFailsFastWithoutInvokingOperation() {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig(), clock);

        trip(cb);

        assertThatThrownBy(() -> succeed(cb))
            .isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(operationCalls.get()).isEqualTo(2);
    }

    @Test
    void open_RejectsUntilTimeoutThenAdmitsProbe() throws Exception {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig(), clock);
        trip(cb);

        clock.advance(OPEN_TIMEOUT.minusMillis(1));
        assertThatThrownBy(() -> succeed(cb)).isInstanceOf(CircuitBreakerOpenException.class);

        clock.advance(Duration.ofMillis(1));
        assertThat(succeed(cb)).isEqualTo("ok");
        assertThat(operationCalls.get()).isEqualTo(3);
    }

    @Test
    void open_LongIdleStillAdmitsOneProbe() throws Exception {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig(), clock);
        trip(cb);

        clock.advance(Duration.ofDays(30));

        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(succeed(cb)).isEqualTo("ok");
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void halfOpen_SingleFailingProbeReopens() {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig().withMaxHalfOpenRequests(3), clock);
        trip(cb);
        clock.advance(OPEN_TIMEOUT);

        fail(cb);

        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> succeed(cb))
            .isInstanceOfSatisfying(CircuitBreakerOpenException.class,
                e -> assertThat(e.getState()).isEqualTo(CircuitBreakerState.OPEN));
        assertThat(operationCalls.get()).isEqualTo(3);
    }

    @Test
    void halfOpen_MaxHalfOpenRequestsSuccessesClose() throws Exception {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig().withMaxHalfOpenRequests(3), clock);
        trip(cb);
        clock.advance(OPEN_TIMEOUT);

        succeed(cb);
        succeed(cb);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);

        succeed(cb);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);

        for (int i = 0; i < 10; i++) {
            assertThat(succeed(cb)).isEqualTo("ok");
        }
        assertThat(operationCalls.get()).isEqualTo(2 + 3 + 10);
    }

    @Test
    void halfOpen_RejectsAdmissionsBeyondProbeBudget() {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig().withMaxHalfOpenRequests(2), clock);
        trip(cb);
        clock.advance(OPEN_TIMEOUT);

        Permit first = cb.tryAcquirePermit();
        Permit second = cb.tryAcquirePermit();

        assertThatThrownBy(cb::tryAcquirePermit)
            .isInstanceOfSatisfying(CircuitBreakerOpenException.class,
                e -> assertThat(e.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN));

        first.onSuccess();
        second.onSuccess();
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void transition_ResetsCountsAndDiscardsStaleOutcome() {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig(), clock);

        // 느린 호출: CLOSED 세대에서 허가를 받은 뒤 결과 보고가 늦어짐
        Permit slow = cb.tryAcquirePermit();

        trip(cb);
        assertThat(cb.getCounts()).isEqualTo(Counts.empty());

        clock.advance(OPEN_TIMEOUT);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);

        slow.onSuccess();

        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(cb.getCounts()).isEqualTo(Counts.empty());
        assertThat(slow.generation()).isNotEqualTo(cb.tryAcquirePermit().generation());
    }

    @Test
    void execute_ReturnsOperationResultAndExceptionUnchanged() {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig(), clock);
        Object value = new Object();
        IOException failure = new IOException("boom");

        Object returned = cb.executeSupplier(() -> value);
        assertThat(returned).isSameAs(value);

        assertThatThrownBy(() -> cb.execute(() -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    void scenario_TwoFailuresTripThenProbeClosesThenNormalOperation() throws Exception {
        CircuitBreaker cb = newCircuitBreaker(twoFailuresConfig(), clock);

        fail(cb);
        fail(cb);
        assertThatThrownBy(() -> succeed(cb)).isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(operationCalls.get()).isEqualTo(2);

        clock.advance(OPEN_TIMEOUT);
        assertThat(succeed(cb)).isEqualTo("ok");
        assertThat(operationCalls.get()).isEqualTo(3);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);

        assertThat(succeed(cb)).isEqualTo("ok");
        assertThat(operationCalls.get()).isEqualTo(4);
    }
}
