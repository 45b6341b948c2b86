package com.starscape.classtag.features.subjects.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A photographed student. Belongs to exactly one event and optionally to a course.
 */
@Entity
@Table(name = "subjects")
public class Subject extends com.starscape.classtag.common.domain.Entity<UUID> {

    @Id
    @Column(name = "subject_id")
    private UUID subjectId;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 20)
    private String grade;

    @Column(name = "course_id")
    private UUID courseId;

    @Column(name = "token_expires_at")
    private Instant tokenExpiresAt;

    protected Subject() {
        // JPA constructor
    }

    public Subject(UUID subjectId, UUID eventId, String name, String grade, UUID courseId, Instant tokenExpiresAt) {
        super(subjectId);
        if (eventId == null) {
            throw new IllegalArgumentException("Event ID is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Subject name cannot be blank");
        }
        this.subjectId = subjectId;
        this.eventId = eventId;
        this.name = name;
        this.grade = grade;
        this.courseId = courseId;
        this.tokenExpiresAt = tokenExpiresAt;
    }

    public boolean belongsTo(UUID eventId) {
        return this.eventId.equals(eventId);
    }

    public boolean isTokenExpiredAt(Instant now) {
        return tokenExpiresAt != null && !now.isBefore(tokenExpiresAt);
    }

    @Override
    public UUID getId() {
        return subjectId;
    }

    // Getters
    public UUID getSubjectId() { return subjectId; }
    public UUID getEventId() { return eventId; }
    public String getName() { return name; }
    public String getGrade() { return grade; }
    public UUID getCourseId() { return courseId; }
    public Instant getTokenExpiresAt() { return tokenExpiresAt; }
}
