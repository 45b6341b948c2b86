package com.starscape.classtag.features.accesstoken.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Scoped, hashed access token. Only the salted SHA-256 of the plaintext is
 * stored; the plaintext leaves the service once, at issuance.
 *
 * Validity is a pure function of the stored fields at evaluation time, see
 * {@link #statusAt(Instant)}.
 */
@Entity
@Table(name = "access_tokens")
public class AccessToken extends com.starscape.classtag.common.domain.Entity<String> {

    @Id
    @Column(name = "token_id", length = 40)
    private String tokenId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TokenScope scope;

    @Column(name = "resource_id", nullable = false)
    private UUID resourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "access_level", nullable = false, length = 20)
    private AccessLevel accessLevel;

    @Column(name = "can_download", nullable = false)
    private boolean canDownload;

    @Column(name = "token_hash", nullable = false)
    private byte[] tokenHash;

    @Column(nullable = false)
    private byte[] salt;

    @Column(name = "token_prefix", nullable = false, length = 12)
    private String tokenPrefix;

    @Column(name = "max_uses")
    private Integer maxUses;

    @Column(name = "used_count", nullable = false)
    private int usedCount;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    protected AccessToken() {
        // JPA constructor
    }

    public AccessToken(String tokenId, TokenScope scope, UUID resourceId, AccessLevel accessLevel,
                       boolean canDownload, byte[] tokenHash, byte[] salt, String tokenPrefix,
                       Integer maxUses, Instant expiresAt, String createdBy, Instant createdAt) {
        super(tokenId);
        if (scope == null) {
            throw new IllegalArgumentException("Token scope is required");
        }
        if (resourceId == null) {
            throw new IllegalArgumentException("Resource ID is required");
        }
        if (maxUses != null && maxUses <= 0) {
            throw new IllegalArgumentException("maxUses must be greater than 0");
        }
        if (tokenHash == null || tokenHash.length != 32) {
            throw new IllegalArgumentException("Token hash must be 32 bytes");
        }
        if (salt == null || salt.length != 16) {
            throw new IllegalArgumentException("Token salt must be 16 bytes");
        }

        this.tokenId = tokenId;
        this.scope = scope;
        this.resourceId = resourceId;
        this.accessLevel = accessLevel != null ? accessLevel : AccessLevel.READ_ONLY;
        this.canDownload = canDownload;
        this.tokenHash = tokenHash.clone();
        this.salt = salt.clone();
        this.tokenPrefix = tokenPrefix;
        this.maxUses = maxUses;
        this.usedCount = 0;
        this.expiresAt = expiresAt;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    /**
     * Evaluate the lifecycle state at the given instant. Revocation wins over
     * expiry, expiry over exhaustion.
     */
    public TokenStatus statusAt(Instant now) {
        if (revokedAt != null) {
            return TokenStatus.REVOKED;
        }
        if (expiresAt != null && !now.isBefore(expiresAt)) {
            return TokenStatus.EXPIRED;
        }
        if (maxUses != null && usedCount >= maxUses) {
            return TokenStatus.EXHAUSTED;
        }
        return TokenStatus.ACTIVE;
    }

    public boolean isValidAt(Instant now) {
        return statusAt(now).isUsable();
    }

    /**
     * One-way transition to REVOKED. Revoking twice keeps the first timestamp.
     * @return true if this call revoked the token
     */
    public boolean revoke(Instant now) {
        if (revokedAt != null) {
            return false;
        }
        this.revokedAt = now;
        return true;
    }

    @Override
    public String getId() {
        return tokenId;
    }

    // Getters
    public String getTokenId() { return tokenId; }
    public TokenScope getScope() { return scope; }
    public UUID getResourceId() { return resourceId; }
    public AccessLevel getAccessLevel() { return accessLevel; }
    public boolean isCanDownload() { return canDownload; }
    public byte[] getTokenHash() { return tokenHash.clone(); }
    public byte[] getSalt() { return salt.clone(); }
    public String getTokenPrefix() { return tokenPrefix; }
    public Integer getMaxUses() { return maxUses; }
    public int getUsedCount() { return usedCount; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getRevokedAt() { return revokedAt; }
    public Instant getLastUsedAt() { return lastUsedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public String getCreatedBy() { return createdBy; }
}
