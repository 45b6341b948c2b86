package com.starscape.classtag.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for batch tagging.
 * Binds to app.tagging.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.tagging")
public class TaggingProperties {

    private int qrBatchLimit = 50;
    private int manualBatchLimit = 100;
    private int transactionTimeoutSeconds = 5;

    public int getQrBatchLimit() {
        return qrBatchLimit;
    }

    public void setQrBatchLimit(int qrBatchLimit) {
        this.qrBatchLimit = qrBatchLimit;
    }

    public int getManualBatchLimit() {
        return manualBatchLimit;
    }

    public void setManualBatchLimit(int manualBatchLimit) {
        this.manualBatchLimit = manualBatchLimit;
    }

    public int getTransactionTimeoutSeconds() {
        return transactionTimeoutSeconds;
    }

    public void setTransactionTimeoutSeconds(int transactionTimeoutSeconds) {
        this.transactionTimeoutSeconds = transactionTimeoutSeconds;
    }
}
