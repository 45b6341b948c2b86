package com.starscape.classtag.features.tagging.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a batch was produced. Each workflow has its own batch-size ceiling,
 * configured under app.tagging.
 */
public enum TaggingWorkflow {

    QR_TAGGING("qr_tagging"),
    MANUAL_TAGGING("manual_tagging");

    private final String wireName;

    TaggingWorkflow(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static TaggingWorkflow fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (TaggingWorkflow workflow : values()) {
            if (workflow.wireName.equalsIgnoreCase(value) || workflow.name().equalsIgnoreCase(value)) {
                return workflow;
            }
        }
        throw new IllegalArgumentException("Unknown tagging workflow: " + value);
    }
}
