package com.starscape.classtag.common.config;

import com.starscape.classtag.common.ratelimit.RateLimitPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for per-endpoint rate limiting.
 * Binds to app.rate-limit.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private Map<RateLimitPolicy, Limit> policies = new EnumMap<>(RateLimitPolicy.class);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<RateLimitPolicy, Limit> getPolicies() {
        return policies;
    }

    public void setPolicies(Map<RateLimitPolicy, Limit> policies) {
        this.policies = policies;
    }

    /**
     * Resolve the limit for a policy, falling back to the policy's built-in default.
     * @param policy The endpoint class
     * @return configured limit, never null
     */
    public Limit limitFor(RateLimitPolicy policy) {
        Limit configured = policies.get(policy);
        if (configured == null || configured.getMaxRequests() <= 0 || configured.getWindow() == null) {
            return new Limit(policy.getDefaultMaxRequests(), policy.getDefaultWindow(), policy.getDefaultBlock());
        }
        Duration block = configured.getBlock() != null ? configured.getBlock() : policy.getDefaultBlock();
        return new Limit(configured.getMaxRequests(), configured.getWindow(), block);
    }

    public static class Limit {

        private int maxRequests;
        private Duration window;
        private Duration block;

        public Limit() {
        }

        public Limit(int maxRequests, Duration window) {
            this(maxRequests, window, null);
        }

        public Limit(int maxRequests, Duration window, Duration block) {
            this.maxRequests = maxRequests;
            this.window = window;
            this.block = block;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Duration getBlock() {
            return block;
        }

        public void setBlock(Duration block) {
            this.block = block;
        }
    }
}
