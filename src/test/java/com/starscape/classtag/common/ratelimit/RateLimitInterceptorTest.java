package com.starscape.classtag.common.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.classtag.common.config.ClientIpProperties;
import com.starscape.classtag.common.config.RateLimitProperties;
import com.starscape.classtag.common.web.ClientIpResolver;
import com.starscape.classtag.features.accesstoken.app.TokenCrypto;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitInterceptorTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private SlidingWindowRateLimiter rateLimiter;
    private ClientIpResolver clientIpResolver;
    private RateLimitInterceptor interceptor;

    @BeforeEach
    void setUp() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.getPolicies().put(RateLimitPolicy.BATCH_TAG, new RateLimitProperties.Limit(1, Duration.ofMinutes(1)));
        rateLimiter = new SlidingWindowRateLimiter(properties, Clock.systemUTC());

        ClientIpProperties clientIpProperties = new ClientIpProperties();
        clientIpProperties.setTrustedProxies(List.of("10.0.0.1"));
        clientIpResolver = new ClientIpResolver(clientIpProperties);

        interceptor = new RateLimitInterceptor(rateLimiter, clientIpResolver, RateLimitPolicy.BATCH_TAG, objectMapper);
    }

    @Test
    @DisplayName("preHandle - Within limit: Should pass and expose remaining quota")
    void preHandle_Allowed() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        boolean proceed = interceptor.preHandle(request("10.0.0.1"), response, new Object());

        assertTrue(proceed);
        assertEquals("1", response.getHeader("X-RateLimit-Limit"));
        assertEquals("0", response.getHeader("X-RateLimit-Remaining"));
        assertEquals("BATCH_TAG", response.getHeader("X-RateLimit-Policy"));
    }

    @Test
    @DisplayName("preHandle - Over limit: Should answer 429 with Retry-After and error body")
    void preHandle_Rejected() throws Exception {
        interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), new Object());
        MockHttpServletResponse response = new MockHttpServletResponse();

        boolean proceed = interceptor.preHandle(request("10.0.0.1"), response, new Object());

        assertFalse(proceed);
        assertEquals(429, response.getStatus());
        assertNotNull(response.getHeader("Retry-After"));
        assertTrue(response.getContentAsString().contains("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    @DisplayName("preHandle - Client forwarded by a trusted proxy: Should be limited separately from the proxy")
    void preHandle_ForwardedByTrustedProxy() throws Exception {
        interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), new Object());
        MockHttpServletRequest forwarded = request("10.0.0.1");
        forwarded.addHeader("X-Forwarded-For", "203.0.113.7");

        assertTrue(interceptor.preHandle(forwarded, new MockHttpServletResponse(), new Object()));
    }

    @Test
    @DisplayName("preHandle - Forwarding header from an untrusted peer: Should not open a new budget")
    void preHandle_SpoofedForwardedFor() throws Exception {
        interceptor.preHandle(request("198.51.100.4"), new MockHttpServletResponse(), new Object());
        MockHttpServletRequest spoofed = request("198.51.100.4");
        spoofed.addHeader("X-Forwarded-For", "203.0.113.99");

        assertFalse(interceptor.preHandle(spoofed, new MockHttpServletResponse(), new Object()));
    }

    @Test
    @DisplayName("preHandle - Distinct guessed tokens from one IP: Should share one validation budget")
    void preHandle_TokenGuessesShareBudget() throws Exception {
        // Arrange
        RateLimitInterceptor tokenInterceptor = new RateLimitInterceptor(
                rateLimiter, clientIpResolver, RateLimitPolicy.TOKEN_VALIDATION, objectMapper);
        TokenCrypto tokenCrypto = new TokenCrypto();

        // Act
        for (int i = 0; i < 50; i++) {
            MockHttpServletRequest guess = tokenRequest("203.0.113.7", tokenCrypto.generate(TokenScope.EVENT).plaintext());
            assertTrue(tokenInterceptor.preHandle(guess, new MockHttpServletResponse(), new Object()));
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        boolean proceed = tokenInterceptor.preHandle(
                tokenRequest("203.0.113.7", tokenCrypto.generate(TokenScope.FAMILY).plaintext()), response, new Object());

        // Assert
        assertFalse(proceed);
        assertEquals(429, response.getStatus());
        assertEquals("3600", response.getHeader("Retry-After"));
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/commands/tagging/batch");
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    private static MockHttpServletRequest tokenRequest(String remoteAddr, String token) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/public/access-tokens/validate");
        request.setRemoteAddr(remoteAddr);
        request.setContentType("application/json");
        request.setContent(("{\"token\":\"" + token + "\"}").getBytes(StandardCharsets.UTF_8));
        return request;
    }
}
