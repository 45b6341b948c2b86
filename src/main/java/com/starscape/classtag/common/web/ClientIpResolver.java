package com.starscape.classtag.common.web;

import com.starscape.classtag.common.config.ClientIpProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Resolves the originating client address behind proxies and load balancers.
 *
 * Forwarding headers are only read when the direct peer is a trusted proxy.
 * X-Forwarded-For is walked from the right, skipping trusted proxies, so a
 * client cannot choose its own address by prepending entries.
 */
@Component
public class ClientIpResolver {

    private final Set<String> trustedProxies;

    public ClientIpResolver(ClientIpProperties properties) {
        this.trustedProxies = new HashSet<>(properties.getTrustedProxies());
    }

    public String resolve(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!trustedProxies.contains(remoteAddr)) {
            return remoteAddr;
        }

        // X-Forwarded-For can contain multiple IPs: client, proxy1, proxy2
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            String[] hops = xForwardedFor.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String hop = hops[i].trim();
                if (!hop.isEmpty() && !trustedProxies.contains(hop)) {
                    return hop;
                }
            }
            return hops[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }

        return remoteAddr;
    }
}
