package com.itemhub.backend.infra;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class TestClockConfig {

    public static final ZoneId TEST_ZONE = ZoneOffset.UTC;
    public static final Instant TEST_START = LocalDateTime.of(2026, 1, 1, 0, 0).atZone(TEST_ZONE).toInstant();
    public static final MutableClock TEST_CLOCK = new MutableClock(TEST_START, TEST_ZONE);

    public static void reset() {
        TEST_CLOCK.set(TEST_START);
    }

    @Bean
    @Primary // 앱에 Clock Bean이 있어도 테스트에선 이게 우선
    Clock testClock() {
        return TEST_CLOCK;
    }

    /**
     * 테스트에서 시간을 직접 움직이는 Clock (토큰 만료 경계 검증용)
     * - 단위 테스트에서는 new MutableClock(...)으로 따로 만들어 쓴다.
     */
    public static final class MutableClock extends Clock {
        private final ZoneId zone;
        private final AtomicReference<Instant> now;

        public MutableClock(Instant initialInstant, ZoneId zone) {
            this.zone = zone;
            this.now = new AtomicReference<>(initialInstant);
        }

        public static MutableClock startingAtTestStart() {
            return new MutableClock(TEST_START, TEST_ZONE);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(now.get(), zone);
        }

        @Override
        public Instant instant() {
            return now.get();
        }

        public void set(Instant instant) {
            now.set(instant);
        }

        public void advance(Duration d) {
            now.updateAndGet(i -> i.plus(d));
        }
    }
}
