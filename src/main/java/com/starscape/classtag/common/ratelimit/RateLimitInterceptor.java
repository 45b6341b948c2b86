package com.starscape.classtag.common.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.classtag.common.exception.GlobalExceptionHandler.ErrorResponse;
import com.starscape.classtag.common.web.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Instant;
import java.util.Map;

/**
 * Applies one {@link RateLimitPolicy} per client IP before the controller runs.
 */
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final SlidingWindowRateLimiter rateLimiter;
    private final ClientIpResolver clientIpResolver;
    private final RateLimitPolicy policy;
    private final ObjectMapper objectMapper;

    public RateLimitInterceptor(SlidingWindowRateLimiter rateLimiter, ClientIpResolver clientIpResolver,
                                RateLimitPolicy policy, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.clientIpResolver = clientIpResolver;
        this.policy = policy;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        String ipAddress = clientIpResolver.resolve(request);
        RateLimitResult result = rateLimiter.allow(ipAddress, policy);

        response.setHeader("X-RateLimit-Limit", String.valueOf(result.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(result.getRemaining()));
        response.setHeader("X-RateLimit-Policy", policy.name());

        if (result.isAllowed()) {
            return true;
        }

        log.warn("Rate limit exceeded for ip: {}, policy: {}", ipAddress, policy);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(result.getRetryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        ErrorResponse body = new ErrorResponse(
            "RATE_LIMIT_EXCEEDED",
            "Too many requests",
            Map.of("retryAfterSeconds", String.valueOf(result.getRetryAfterSeconds())),
            Instant.now()
        );
        objectMapper.writeValue(response.getWriter(), body);
        return false;
    }
}
