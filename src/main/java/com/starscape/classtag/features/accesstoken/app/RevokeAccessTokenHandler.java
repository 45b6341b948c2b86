package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.exception.NotFoundException;
import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Handler for revoking an access token. Revocation is permanent and idempotent.
 */
@Service
public class RevokeAccessTokenHandler {

    private static final Logger log = LoggerFactory.getLogger(RevokeAccessTokenHandler.class);

    private final AccessTokenRepository tokenRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public RevokeAccessTokenHandler(
            AccessTokenRepository tokenRepository,
            AuditLogService auditLogService,
            Clock clock) {
        this.tokenRepository = tokenRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional
    public AccessTokenSummary handle(String tokenId) {
        AccessToken token = tokenRepository.findById(tokenId)
                .orElseThrow(() -> new NotFoundException("Access token not found: " + tokenId));

        Instant now = Instant.now(clock);
        boolean revokedNow = token.revoke(now);
        if (revokedNow) {
            tokenRepository.save(token);
            log.info("Revoked token {}", tokenId);
            auditLogService.success(AuditAction.TOKEN_REVOKED, tokenId,
                    Map.of("usedCount", token.getUsedCount()));
        } else {
            log.debug("Token {} already revoked at {}", tokenId, token.getRevokedAt());
        }

        return AccessTokenSummary.from(token, now);
    }
}
