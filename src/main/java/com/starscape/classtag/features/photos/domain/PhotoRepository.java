package com.starscape.classtag.features.photos.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PhotoRepository {
    Photo save(Photo photo);
    Optional<Photo> findById(UUID photoId);
    List<Photo> findByEventIdAndPhotoIdIn(UUID eventId, Collection<UUID> photoIds);
}
