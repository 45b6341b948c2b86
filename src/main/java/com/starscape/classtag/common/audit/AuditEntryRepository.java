package com.starscape.classtag.common.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntry, String> {

    long countBySubjectRefAndActionAndOutcome(String subjectRef, AuditAction action, AuditOutcome outcome);

    Optional<AuditEntry> findFirstBySubjectRefAndActionOrderByOccurredAtDesc(String subjectRef, AuditAction action);
}
