package com.starscape.classtag.features.subjects.domain;

import jakarta.persistence.*;

import java.util.UUID;

/**
 * Photography event (one school day or session). Read model owned by event
 * administration; this service only checks whether it is active.
 */
@Entity
@Table(name = "events")
public class SchoolEvent extends com.starscape.classtag.common.domain.Entity<UUID> {

    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false)
    private boolean active;

    protected SchoolEvent() {
        // JPA constructor
    }

    public SchoolEvent(UUID eventId, String name, boolean active) {
        super(eventId);
        this.eventId = eventId;
        this.name = name;
        this.active = active;
    }

    @Override
    public UUID getId() {
        return eventId;
    }

    // Getters
    public UUID getEventId() { return eventId; }
    public String getName() { return name; }
    public boolean isActive() { return active; }
}
