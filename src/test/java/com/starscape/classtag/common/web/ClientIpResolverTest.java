package com.starscape.classtag.common.web;

import com.starscape.classtag.common.config.ClientIpProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClientIpResolverTest {

    private ClientIpResolver resolver;

    @BeforeEach
    void setUp() {
        ClientIpProperties properties = new ClientIpProperties();
        properties.setTrustedProxies(List.of("10.0.0.1", "10.0.0.2"));
        resolver = new ClientIpResolver(properties);
    }

    @Test
    @DisplayName("resolve - Untrusted peer: Should ignore forwarding headers")
    void resolve_UntrustedPeer() {
        MockHttpServletRequest request = request("198.51.100.4");
        request.addHeader("X-Forwarded-For", "203.0.113.7");
        request.addHeader("X-Real-IP", "203.0.113.8");

        assertEquals("198.51.100.4", resolver.resolve(request));
    }

    @Test
    @DisplayName("resolve - Trusted proxy chain: Should return the nearest untrusted hop")
    void resolve_TrustedChain() {
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader("X-Forwarded-For", "1.2.3.4, 203.0.113.7, 10.0.0.2");

        assertEquals("203.0.113.7", resolver.resolve(request));
    }

    @Test
    @DisplayName("resolve - Trusted proxy with X-Real-IP only: Should use it")
    void resolve_RealIp() {
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader("X-Real-IP", "203.0.113.8");

        assertEquals("203.0.113.8", resolver.resolve(request));
    }

    @Test
    @DisplayName("resolve - No proxies configured: Should use the peer address")
    void resolve_NoProxiesConfigured() {
        ClientIpResolver strict = new ClientIpResolver(new ClientIpProperties());
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader("X-Forwarded-For", "203.0.113.7");

        assertEquals("10.0.0.1", strict.resolve(request));
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/commands/qr/decode");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
