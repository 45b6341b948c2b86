package com.starscape.classtag.features.photos.infra;

import com.starscape.classtag.features.photos.domain.Photo;
import com.starscape.classtag.features.photos.domain.PhotoRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface JpaPhotoRepository extends JpaRepository<Photo, UUID>, PhotoRepository {

    @Override
    @Query("SELECT p FROM Photo p WHERE p.eventId = :eventId AND p.photoId IN :photoIds")
    List<Photo> findByEventIdAndPhotoIdIn(@Param("eventId") UUID eventId, @Param("photoIds") Collection<UUID> photoIds);
}
