package com.starscape.classtag.features.tagging.infra;

import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignment;
import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignmentId;
import com.starscape.classtag.features.tagging.domain.PhotoSubjectAssignmentRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA repository implementation for photo/subject edges.
 * The insert relies on PostgreSQL ON CONFLICT so concurrent identical batches
 * resolve to one row per pair without locking.
 */
@Repository
public interface JpaPhotoSubjectAssignmentRepository
        extends JpaRepository<PhotoSubjectAssignment, PhotoSubjectAssignmentId>, PhotoSubjectAssignmentRepository {

    @Override
    @Modifying
    @Query(value = "INSERT INTO photo_subjects (photo_id, subject_id, tagged_at, tagged_by) " +
                   "VALUES (:photoId, :subjectId, :taggedAt, :taggedBy) " +
                   "ON CONFLICT (photo_id, subject_id) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("photoId") UUID photoId,
                       @Param("subjectId") UUID subjectId,
                       @Param("taggedAt") Instant taggedAt,
                       @Param("taggedBy") String taggedBy);

    @Override
    @Modifying
    @Query("DELETE FROM PhotoSubjectAssignment a WHERE a.photoId = :photoId AND a.subjectId = :subjectId")
    int deleteByPhotoIdAndSubjectId(@Param("photoId") UUID photoId, @Param("subjectId") UUID subjectId);

    @Override
    boolean existsByPhotoIdAndSubjectId(UUID photoId, UUID subjectId);

    @Override
    long countBySubjectId(UUID subjectId);

    @Override
    @Query("SELECT COUNT(a) > 0 FROM PhotoSubjectAssignment a, Subject s " +
           "WHERE a.subjectId = s.subjectId AND a.photoId = :photoId AND s.courseId = :courseId")
    boolean isPhotoTaggedToCourse(@Param("photoId") UUID photoId, @Param("courseId") UUID courseId);
}
