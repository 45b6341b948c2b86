package com.starscape.classtag.common.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.classtag.common.web.ClientIpResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Binds rate limit policies to endpoint classes. Every policy is keyed by client IP.
 *
 * Both public endpoints that accept a token count against
 * {@link RateLimitPolicy#TOKEN_VALIDATION}, so guessing through either one
 * draws from the same budget.
 */
@Configuration
public class RateLimitConfig implements WebMvcConfigurer {

    private final SlidingWindowRateLimiter rateLimiter;
    private final ClientIpResolver clientIpResolver;
    private final ObjectMapper objectMapper;

    public RateLimitConfig(SlidingWindowRateLimiter rateLimiter, ClientIpResolver clientIpResolver,
                           ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.clientIpResolver = clientIpResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(interceptor(RateLimitPolicy.QR_DECODE))
               .addPathPatterns("/commands/qr/decode");
        registry.addInterceptor(interceptor(RateLimitPolicy.BATCH_TAG))
               .addPathPatterns("/commands/tagging/batch");
        registry.addInterceptor(interceptor(RateLimitPolicy.TOKEN_VALIDATION))
               .addPathPatterns("/public/access-tokens/validate", "/public/downloads");
        registry.addInterceptor(interceptor(RateLimitPolicy.DOWNLOAD))
               .addPathPatterns("/public/downloads");
    }

    private RateLimitInterceptor interceptor(RateLimitPolicy policy) {
        return new RateLimitInterceptor(rateLimiter, clientIpResolver, policy, objectMapper);
    }
}
