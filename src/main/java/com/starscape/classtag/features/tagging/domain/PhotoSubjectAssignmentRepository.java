package com.starscape.classtag.features.tagging.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Repository for photo/subject edges. Pair uniqueness is enforced by the
 * storage primary key, not by read-then-write checks.
 */
public interface PhotoSubjectAssignmentRepository {

    /**
     * Insert the edge unless it already exists.
     * @return 1 if a row was inserted, 0 if the pair was already assigned
     */
    int insertIfAbsent(UUID photoId, UUID subjectId, Instant taggedAt, String taggedBy);

    int deleteByPhotoIdAndSubjectId(UUID photoId, UUID subjectId);

    boolean existsByPhotoIdAndSubjectId(UUID photoId, UUID subjectId);

    long countBySubjectId(UUID subjectId);

    /**
     * Whether the photo is tagged to at least one subject enrolled in the course.
     */
    boolean isPhotoTaggedToCourse(UUID photoId, UUID courseId);
}
