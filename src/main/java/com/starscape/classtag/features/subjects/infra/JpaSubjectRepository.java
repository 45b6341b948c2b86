package com.starscape.classtag.features.subjects.infra;

import com.starscape.classtag.features.subjects.domain.Subject;
import com.starscape.classtag.features.subjects.domain.SubjectRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface JpaSubjectRepository extends JpaRepository<Subject, UUID>, SubjectRepository {

    @Override
    boolean existsByCourseId(UUID courseId);
}
