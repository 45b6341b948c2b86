package com.starscape.classtag.features.accesstoken.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AccessTokenRepository {
    AccessToken save(AccessToken token);
    Optional<AccessToken> findById(String tokenId);
    List<AccessToken> findByTokenPrefix(String tokenPrefix);
    List<AccessToken> findByScopeAndResourceIdOrderByCreatedAtDesc(TokenScope scope, UUID resourceId);
    List<AccessToken> findByScopeOrderByCreatedAtDesc(TokenScope scope);

    /**
     * Count one use, but only while the token is still usable at {@code now}.
     * @return 1 if the use was recorded, 0 if the token was revoked, expired or exhausted
     */
    int incrementUsageIfUsable(String tokenId, Instant now);

    /**
     * Delete tokens revoked or expired before the cutoff.
     * @return number of tokens removed
     */
    int deleteRetiredBefore(Instant cutoff);
}
