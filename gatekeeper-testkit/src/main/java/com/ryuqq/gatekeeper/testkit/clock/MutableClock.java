package com.ryuqq.gatekeeper.testkit.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트용 수동 시계.
 *
 * <p>openTimeout, closedCountingInterval 경과를 sleep 없이 재현할 때 사용합니다.
 * 여러 스레드에서 읽을 수 있도록 현재 시각은 volatile로 보관합니다.</p>
 *
 * @author Gatekeeper Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant now;

    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    /**
     * 고정 시작 시각(2024-01-01T00:00:00Z)으로 생성.
     */
    public static MutableClock startingAtEpochOf2024() {
        return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    public void setTime(Instant instant) {
        this.now = instant;
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
