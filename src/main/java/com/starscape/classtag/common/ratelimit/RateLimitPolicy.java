package com.starscape.classtag.common.ratelimit;

import java.time.Duration;

/**
 * Endpoint classes with independent request budgets.
 * Defaults apply when app.rate-limit.policies does not override them.
 * A non-zero block keeps a key rejected for that long once it exceeds its quota.
 */
public enum RateLimitPolicy {

    QR_DECODE(30, Duration.ofMinutes(1), Duration.ZERO),
    BATCH_TAG(10, Duration.ofMinutes(1), Duration.ZERO),
    TOKEN_VALIDATION(50, Duration.ofMinutes(15), Duration.ofHours(1)),
    DOWNLOAD(60, Duration.ofMinutes(1), Duration.ZERO);

    private final int defaultMaxRequests;
    private final Duration defaultWindow;
    private final Duration defaultBlock;

    RateLimitPolicy(int defaultMaxRequests, Duration defaultWindow, Duration defaultBlock) {
        this.defaultMaxRequests = defaultMaxRequests;
        this.defaultWindow = defaultWindow;
        this.defaultBlock = defaultBlock;
    }

    public int getDefaultMaxRequests() {
        return defaultMaxRequests;
    }

    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    public Duration getDefaultBlock() {
        return defaultBlock;
    }
}
