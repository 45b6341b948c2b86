package com.starscape.classtag.features.subjects.domain;

import java.util.Optional;
import java.util.UUID;

public interface SchoolEventRepository {
    SchoolEvent save(SchoolEvent event);
    Optional<SchoolEvent> findById(UUID eventId);
    boolean existsById(UUID eventId);
}
