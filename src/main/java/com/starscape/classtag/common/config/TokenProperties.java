package com.starscape.classtag.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for access token issuance and retention.
 * Binds to app.tokens.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.tokens")
public class TokenProperties {

    private int defaultExpiryDays = 30;
    private int retentionDays = 30;

    public int getDefaultExpiryDays() {
        return defaultExpiryDays;
    }

    public void setDefaultExpiryDays(int defaultExpiryDays) {
        this.defaultExpiryDays = defaultExpiryDays;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }
}
