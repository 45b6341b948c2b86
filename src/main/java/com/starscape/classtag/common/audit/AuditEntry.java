package com.starscape.classtag.common.audit;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Append-only record of a security-relevant operation.
 */
@Entity
@Table(name = "audit_log")
public class AuditEntry {

    @Id
    @Column(name = "audit_id")
    private String auditId;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditOutcome outcome;

    @Column(nullable = false, length = 100)
    private String actor;

    @Column(name = "client_ip", length = 64)
    private String clientIp;

    @Column(name = "subject_ref", length = 100)
    private String subjectRef;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private String details;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected AuditEntry() {
        // JPA constructor
    }

    public AuditEntry(String auditId, String correlationId, AuditAction action, AuditOutcome outcome,
                      String actor, String clientIp, String subjectRef, String details, Instant occurredAt) {
        this.auditId = auditId;
        this.correlationId = correlationId;
        this.action = action;
        this.outcome = outcome;
        this.actor = actor;
        this.clientIp = clientIp;
        this.subjectRef = subjectRef;
        this.details = details;
        this.occurredAt = occurredAt;
    }

    // Getters
    public String getAuditId() { return auditId; }
    public String getCorrelationId() { return correlationId; }
    public AuditAction getAction() { return action; }
    public AuditOutcome getOutcome() { return outcome; }
    public String getActor() { return actor; }
    public String getClientIp() { return clientIp; }
    public String getSubjectRef() { return subjectRef; }
    public String getDetails() { return details; }
    public Instant getOccurredAt() { return occurredAt; }
}
