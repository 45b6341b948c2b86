package com.starscape.classtag.features.tagging.domain;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * Composite key for PhotoSubjectAssignment entity.
 */
public class PhotoSubjectAssignmentId implements Serializable {

    private UUID photoId;
    private UUID subjectId;

    public PhotoSubjectAssignmentId() {
        // JPA constructor
    }

    public PhotoSubjectAssignmentId(UUID photoId, UUID subjectId) {
        this.photoId = photoId;
        this.subjectId = subjectId;
    }

    public UUID getPhotoId() { return photoId; }
    public void setPhotoId(UUID photoId) { this.photoId = photoId; }

    public UUID getSubjectId() { return subjectId; }
    public void setSubjectId(UUID subjectId) { this.subjectId = subjectId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PhotoSubjectAssignmentId that = (PhotoSubjectAssignmentId) o;
        return Objects.equals(photoId, that.photoId) && Objects.equals(subjectId, that.subjectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(photoId, subjectId);
    }
}
