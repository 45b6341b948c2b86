package com.starscape.classtag.features.photos.domain;

import jakarta.persistence.*;

import java.util.UUID;

/**
 * Uploaded event photo. Approval happens in the moderation workflow; only
 * approved photos may be tagged or downloaded.
 */
@Entity
@Table(name = "photos")
public class Photo extends com.starscape.classtag.common.domain.Entity<UUID> {

    @Id
    @Column(name = "photo_id")
    private UUID photoId;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(nullable = false)
    private boolean approved;

    @Column(nullable = false, length = 255)
    private String filename;

    @Column(name = "storage_path", length = 500)
    private String storagePath;

    protected Photo() {
        // JPA constructor
    }

    public Photo(UUID photoId, UUID eventId, boolean approved, String filename, String storagePath) {
        super(photoId);
        if (eventId == null) {
            throw new IllegalArgumentException("Event ID is required");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be blank");
        }
        this.photoId = photoId;
        this.eventId = eventId;
        this.approved = approved;
        this.filename = filename;
        this.storagePath = storagePath;
    }

    @Override
    public UUID getId() {
        return photoId;
    }

    // Getters
    public UUID getPhotoId() { return photoId; }
    public UUID getEventId() { return eventId; }
    public boolean isApproved() { return approved; }
    public String getFilename() { return filename; }
    public String getStoragePath() { return storagePath; }
}
