package com.ryuqq.gatekeeper.core.protection.policy;

import com.ryuqq.gatekeeper.core.protection.Counts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TripPoliciesTest {

    @Test
    void failureRatio_최소_요청수_미만이면_실패율과_무관하게_false() {
        TripPolicy policy = TripPolicies.failureRatio(5, 0.6);

        assertThat(policy.shouldTrip(new Counts(4, 0, 4, 0, 4))).isFalse();
        assertThat(policy.shouldTrip(Counts.empty())).isFalse();
    }

    @Test
    void failureRatio_임계값_이상이면_true() {
        TripPolicy policy = TripPolicies.failureRatio(5, 0.6);

        assertThat(policy.shouldTrip(new Counts(10, 4, 6, 0, 1))).isTrue();
        assertThat(policy.shouldTrip(new Counts(10, 5, 5, 0, 5))).isFalse();
    }

    @Test
    void failureRatio_잘못된_파라미터는_예외() {
        assertThatThrownBy(() -> TripPolicies.failureRatio(0, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TripPolicies.failureRatio(5, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TripPolicies.failureRatio(5, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TripPolicies.failureRatio(5, Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void consecutiveFailures_연속_실패만_본다() {
        TripPolicy policy = TripPolicies.consecutiveFailures(3);

        assertThat(policy.shouldTrip(new Counts(100, 90, 10, 0, 2))).isFalse();
        assertThat(policy.shouldTrip(new Counts(3, 0, 3, 0, 3))).isTrue();
    }

    @Test
    void minimumFailures_요청수와_실패수를_모두_충족해야_true() {
        TripPolicy policy = TripPolicies.minimumFailures(2, 2);

        assertThat(policy.shouldTrip(new Counts(1, 0, 1, 0, 1))).isFalse();
        assertThat(policy.shouldTrip(new Counts(2, 1, 1, 0, 1))).isFalse();
        assertThat(policy.shouldTrip(new Counts(2, 0, 2, 0, 2))).isTrue();
    }

    @Test
    void defaultPolicy_는_같은_인스턴스를_재사용한다() {
        assertThat(TripPolicies.defaultPolicy()).isSameAs(TripPolicies.defaultPolicy());
    }
}
