package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditEntry;
import com.starscape.classtag.common.audit.AuditEntryRepository;
import com.starscape.classtag.common.audit.AuditOutcome;
import com.starscape.classtag.common.exception.NotFoundException;
import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Usage statistics for one token, combining the stored counter with
 * validation outcomes from the audit log.
 */
@Service
public class TokenUsageStatsHandler {

    private final AccessTokenRepository tokenRepository;
    private final AuditEntryRepository auditRepository;
    private final Clock clock;

    public TokenUsageStatsHandler(
            AccessTokenRepository tokenRepository,
            AuditEntryRepository auditRepository,
            Clock clock) {
        this.tokenRepository = tokenRepository;
        this.auditRepository = auditRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public TokenUsageStats handle(String tokenId) {
        AccessToken token = tokenRepository.findById(tokenId)
                .orElseThrow(() -> new NotFoundException("Access token not found: " + tokenId));

        long successful = auditRepository.countBySubjectRefAndActionAndOutcome(
                tokenId, AuditAction.TOKEN_VALIDATED, AuditOutcome.SUCCESS);
        long failed = auditRepository.countBySubjectRefAndActionAndOutcome(
                tokenId, AuditAction.TOKEN_VALIDATED, AuditOutcome.FAILURE);
        Instant lastAccess = auditRepository
                .findFirstBySubjectRefAndActionOrderByOccurredAtDesc(tokenId, AuditAction.TOKEN_VALIDATED)
                .map(AuditEntry::getOccurredAt)
                .orElse(token.getLastUsedAt());

        return new TokenUsageStats(
            tokenId,
            token.statusAt(Instant.now(clock)),
            token.getUsedCount(),
            token.getMaxUses(),
            successful + failed,
            successful,
            failed,
            lastAccess
        );
    }
}
