package com.starscape.classtag.features.subjects.infra;

import com.starscape.classtag.features.subjects.domain.SchoolEvent;
import com.starscape.classtag.features.subjects.domain.SchoolEventRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface JpaSchoolEventRepository extends JpaRepository<SchoolEvent, UUID>, SchoolEventRepository {
}
