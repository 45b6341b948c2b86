package com.starscape.classtag.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for resolving the client address.
 * Binds to app.client-ip.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.client-ip")
public class ClientIpProperties {

    /**
     * Addresses of reverse proxies whose X-Forwarded-For and X-Real-IP headers are honoured.
     * Forwarding headers from any other peer are ignored.
     */
    private List<String> trustedProxies = new ArrayList<>();

    public List<String> getTrustedProxies() {
        return trustedProxies;
    }

    public void setTrustedProxies(List<String> trustedProxies) {
        this.trustedProxies = trustedProxies;
    }
}
