package com.starscape.classtag.features.tagging.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Edge between a photo and the subject shown in it. At most one row per pair;
 * rows are never updated and only removed by explicit declassification.
 */
@Entity
@Table(name = "photo_subjects")
@IdClass(PhotoSubjectAssignmentId.class)
public class PhotoSubjectAssignment {

    @Id
    @Column(name = "photo_id", nullable = false)
    private UUID photoId;

    @Id
    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @Column(name = "tagged_at", nullable = false, updatable = false)
    private Instant taggedAt;

    @Column(name = "tagged_by", nullable = false, updatable = false, length = 100)
    private String taggedBy;

    protected PhotoSubjectAssignment() {
        // JPA constructor
    }

    // Getters
    public UUID getPhotoId() { return photoId; }
    public UUID getSubjectId() { return subjectId; }
    public Instant getTaggedAt() { return taggedAt; }
    public String getTaggedBy() { return taggedBy; }
}
