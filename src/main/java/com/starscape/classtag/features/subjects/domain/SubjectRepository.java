package com.starscape.classtag.features.subjects.domain;

import java.util.Optional;
import java.util.UUID;

public interface SubjectRepository {
    Subject save(Subject subject);
    Optional<Subject> findById(UUID subjectId);
    boolean existsById(UUID subjectId);
    boolean existsByCourseId(UUID courseId);
}
