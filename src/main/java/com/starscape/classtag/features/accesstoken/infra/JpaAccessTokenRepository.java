package com.starscape.classtag.features.accesstoken.infra;

import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface JpaAccessTokenRepository extends JpaRepository<AccessToken, String>, AccessTokenRepository {

    @Override
    List<AccessToken> findByTokenPrefix(String tokenPrefix);

    @Override
    List<AccessToken> findByScopeAndResourceIdOrderByCreatedAtDesc(TokenScope scope, UUID resourceId);

    @Override
    List<AccessToken> findByScopeOrderByCreatedAtDesc(TokenScope scope);

    @Override
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AccessToken t SET t.usedCount = t.usedCount + 1, t.lastUsedAt = :now " +
           "WHERE t.tokenId = :tokenId AND t.revokedAt IS NULL " +
           "AND (t.expiresAt IS NULL OR t.expiresAt > :now) " +
           "AND (t.maxUses IS NULL OR t.usedCount < t.maxUses)")
    int incrementUsageIfUsable(@Param("tokenId") String tokenId, @Param("now") Instant now);

    @Override
    @Modifying
    @Query("DELETE FROM AccessToken t WHERE (t.revokedAt IS NOT NULL AND t.revokedAt < :cutoff) " +
           "OR (t.expiresAt IS NOT NULL AND t.expiresAt < :cutoff)")
    int deleteRetiredBefore(@Param("cutoff") Instant cutoff);
}
