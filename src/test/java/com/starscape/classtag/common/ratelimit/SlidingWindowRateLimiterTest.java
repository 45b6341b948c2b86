package com.starscape.classtag.common.ratelimit;

import com.starscape.classtag.common.config.RateLimitProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private MutableClock clock;
    private RateLimitProperties properties;
    private SlidingWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new RateLimitProperties();
        properties.getPolicies().put(RateLimitPolicy.QR_DECODE, new RateLimitProperties.Limit(3, Duration.ofMinutes(1)));
        rateLimiter = new SlidingWindowRateLimiter(properties, clock);
    }

    @Test
    @DisplayName("allow - Admits up to the limit, then rejects with Retry-After")
    void allow_LimitThenReject() {
        // Act
        RateLimitResult first = rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        clock.advance(Duration.ofSeconds(10));
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        RateLimitResult third = rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        RateLimitResult fourth = rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);

        // Assert
        assertTrue(first.isAllowed());
        assertEquals(2, first.getRemaining());
        assertTrue(third.isAllowed());
        assertEquals(0, third.getRemaining());
        assertFalse(fourth.isAllowed());
        assertEquals(3, fourth.getLimit());
        assertEquals(50, fourth.getRetryAfterSeconds());
    }

    @Test
    @DisplayName("allow - Oldest attempt leaving the window frees one slot")
    void allow_SlidesWindow() {
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        clock.advance(Duration.ofSeconds(30));
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        assertFalse(rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE).isAllowed());

        clock.advance(Duration.ofSeconds(31));

        assertTrue(rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE).isAllowed());
        assertFalse(rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE).isAllowed());
    }

    @Test
    @DisplayName("allow - Keys and policies are counted independently")
    void allow_IndependentKeys() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        }

        assertFalse(rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE).isAllowed());
        assertTrue(rateLimiter.allow("10.0.0.2", RateLimitPolicy.QR_DECODE).isAllowed());
        assertTrue(rateLimiter.allow("10.0.0.1", RateLimitPolicy.BATCH_TAG).isAllowed());
    }

    @Test
    @DisplayName("allow - Disabled limiter admits everything")
    void allow_Disabled() {
        properties.setEnabled(false);

        for (int i = 0; i < 10; i++) {
            assertTrue(rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE).isAllowed());
        }
        assertEquals(0, rateLimiter.trackedKeys());
    }

    @Test
    @DisplayName("evictIdleKeys - Drops keys older than the longest window")
    void evictIdleKeys_DropsIdle() {
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.QR_DECODE);
        rateLimiter.allow("10.0.0.2", RateLimitPolicy.QR_DECODE);
        assertEquals(2, rateLimiter.trackedKeys());

        clock.advance(Duration.ofMinutes(16));
        rateLimiter.allow("10.0.0.3", RateLimitPolicy.QR_DECODE);
        rateLimiter.evictIdleKeys();

        assertEquals(1, rateLimiter.trackedKeys());
    }

    @Test
    @DisplayName("allow - Policy with a block: Should stay rejected after the window until the block ends")
    void allow_BlockOutlastsWindow() {
        properties.getPolicies().put(RateLimitPolicy.TOKEN_VALIDATION,
                new RateLimitProperties.Limit(2, Duration.ofMinutes(1), Duration.ofHours(1)));
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.TOKEN_VALIDATION);
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.TOKEN_VALIDATION);

        RateLimitResult exceeded = rateLimiter.allow("10.0.0.1", RateLimitPolicy.TOKEN_VALIDATION);
        clock.advance(Duration.ofMinutes(30));
        RateLimitResult stillBlocked = rateLimiter.allow("10.0.0.1", RateLimitPolicy.TOKEN_VALIDATION);
        rateLimiter.evictIdleKeys();
        int trackedWhileBlocked = rateLimiter.trackedKeys();
        clock.advance(Duration.ofMinutes(31));
        RateLimitResult afterBlock = rateLimiter.allow("10.0.0.1", RateLimitPolicy.TOKEN_VALIDATION);

        assertFalse(exceeded.isAllowed());
        assertEquals(3600, exceeded.getRetryAfterSeconds());
        assertFalse(stillBlocked.isAllowed());
        assertEquals(1800, stillBlocked.getRetryAfterSeconds());
        assertEquals(1, trackedWhileBlocked);
        assertTrue(afterBlock.isAllowed());
    }

    @Test
    @DisplayName("allow - Configured limit without a block: Should inherit the policy default block")
    void allow_DefaultBlockInherited() {
        properties.getPolicies().put(RateLimitPolicy.TOKEN_VALIDATION,
                new RateLimitProperties.Limit(1, Duration.ofMinutes(1)));
        rateLimiter.allow("10.0.0.1", RateLimitPolicy.TOKEN_VALIDATION);

        RateLimitResult exceeded = rateLimiter.allow("10.0.0.1", RateLimitPolicy.TOKEN_VALIDATION);

        assertEquals(RateLimitPolicy.TOKEN_VALIDATION.getDefaultBlock().getSeconds(), exceeded.getRetryAfterSeconds());
    }

    static final class MutableClock extends Clock {

        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
