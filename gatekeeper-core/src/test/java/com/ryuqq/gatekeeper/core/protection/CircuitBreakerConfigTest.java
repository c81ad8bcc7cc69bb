package com.ryuqq.gatekeeper.core.protection;

import com.ryuqq.gatekeeper.core.protection.policy.TripPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CircuitBreakerConfig 테스트")
class CircuitBreakerConfigTest {

    @Test
    @DisplayName("기본 생성자는 문서화된 기본값을 사용한다")
    void 기본값() {
        // when
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        // then
        assertThat(config.name().getValue()).isEqualTo("default");
        assertThat(config.maxHalfOpenRequests()).isEqualTo(5);
        assertThat(config.closedCountingInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.openTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.hasClosedCountingInterval()).isTrue();
        assertThat(config.recordFailurePredicate().test(new IOException())).isTrue();
        assertThat(config.ignoreExceptionPredicate().test(new IOException())).isFalse();
        assertThat(config.recordResultPredicate().test("any")).isFalse();
    }

    @Test
    @DisplayName("기본 TripPolicy는 5건 이상, 실패율 60% 이상에서 trip 한다")
    void 기본_TripPolicy() {
        TripPolicy policy = new CircuitBreakerConfig().tripPolicy();

        assertThat(policy.shouldTrip(new Counts(4, 0, 4, 0, 4))).isFalse();
        assertThat(policy.shouldTrip(new Counts(5, 3, 2, 0, 2))).isFalse();
        assertThat(policy.shouldTrip(new Counts(5, 2, 3, 0, 3))).isTrue();
    }

    @Test
    @DisplayName("withX 메서드는 해당 항목만 바꾼 새 인스턴스를 만든다")
    void withX() {
        // given
        CircuitBreakerConfig original = new CircuitBreakerConfig();

        // when
        CircuitBreakerConfig changed = original
            .withName("search")
            .withMaxHalfOpenRequests(1)
            .withClosedCountingInterval(Duration.ZERO)
            .withOpenTimeout(Duration.ofSeconds(5));

        // then
        assertThat(changed.name().getValue()).isEqualTo("search");
        assertThat(changed.maxHalfOpenRequests()).isEqualTo(1);
        assertThat(changed.hasClosedCountingInterval()).isFalse();
        assertThat(changed.openTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(changed.tripPolicy()).isSameAs(original.tripPolicy());
        assertThat(original.name().getValue()).isEqualTo("default");
    }

    @Test
    @DisplayName("잘못된 설정은 생성 시점에 실패한다")
    void 유효성_검증() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThatThrownBy(() -> config.withMaxHalfOpenRequests(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxHalfOpenRequests");
        assertThatThrownBy(() -> config.withClosedCountingInterval(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("closedCountingInterval");
        assertThatThrownBy(() -> config.withOpenTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("openTimeout");
        assertThatThrownBy(() -> config.withTripPolicy(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withRecordResultPredicate(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withName(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
