package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.exception.InvalidAccessTokenException;
import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import com.starscape.classtag.features.accesstoken.domain.TokenStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates a presented plaintext token and records one use on success.
 *
 * Every candidate sharing the prefix is hashed and compared, and a dummy
 * comparison runs when there is none, so response time does not reveal whether
 * a prefix exists. The use is counted with a conditional update; if that update
 * matches nothing (revoked or exhausted concurrently) the result is invalid.
 */
@Service
public class ValidateAccessTokenHandler {

    private static final Logger log = LoggerFactory.getLogger(ValidateAccessTokenHandler.class);

    private final AccessTokenRepository tokenRepository;
    private final TokenCrypto tokenCrypto;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ValidateAccessTokenHandler(
            AccessTokenRepository tokenRepository,
            TokenCrypto tokenCrypto,
            AuditLogService auditLogService,
            Clock clock) {
        this.tokenRepository = tokenRepository;
        this.tokenCrypto = tokenCrypto;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(timeoutString = "${app.tagging.transaction-timeout-seconds:5}")
    public TokenValidationResult handle(String presented) {
        Instant now = Instant.now(clock);
        Optional<String> prefix = tokenCrypto.prefixOf(presented);
        String maskedPrefix = TokenCrypto.mask(prefix.orElse(null));

        List<AccessToken> candidates = prefix.map(tokenRepository::findByTokenPrefix).orElse(List.of());
        AccessToken match = null;
        if (candidates.isEmpty()) {
            tokenCrypto.burnComparison(presented);
        }
        for (AccessToken candidate : candidates) {
            // No early exit: every candidate costs one hash
            boolean matches = tokenCrypto.matches(presented, candidate.getSalt(), candidate.getTokenHash());
            if (matches && match == null) {
                match = candidate;
            }
        }

        if (match == null) {
            return reject(null, maskedPrefix, ValidationReason.NOT_FOUND);
        }

        TokenStatus status = match.statusAt(now);
        if (!status.isUsable()) {
            return reject(match.getTokenId(), maskedPrefix, ValidationReason.from(status));
        }

        int updated = tokenRepository.incrementUsageIfUsable(match.getTokenId(), now);
        if (updated == 0) {
            ValidationReason reason = tokenRepository.findById(match.getTokenId())
                    .map(current -> current.statusAt(now))
                    .filter(current -> !current.isUsable())
                    .map(ValidationReason::from)
                    .orElse(ValidationReason.EXHAUSTED);
            return reject(match.getTokenId(), maskedPrefix, reason);
        }

        log.debug("Validated token {} ({})", match.getTokenId(), maskedPrefix);
        auditLogService.success(AuditAction.TOKEN_VALIDATED, match.getTokenId(),
                Map.of("token", maskedPrefix, "scope", match.getScope().name()));
        return TokenValidationResult.valid(match);
    }

    /**
     * Validate and return the result, or throw the single public failure.
     */
    @Transactional(timeoutString = "${app.tagging.transaction-timeout-seconds:5}")
    public TokenValidationResult requireValid(String presented) {
        TokenValidationResult result = handle(presented);
        if (!result.valid()) {
            throw new InvalidAccessTokenException();
        }
        return result;
    }

    private TokenValidationResult reject(String tokenId, String maskedPrefix, ValidationReason reason) {
        log.info("Token validation failed: {} ({})", reason, maskedPrefix);
        auditLogService.failure(AuditAction.TOKEN_VALIDATED, tokenId != null ? tokenId : maskedPrefix,
                Map.of("token", maskedPrefix, "reason", reason.name()));
        return TokenValidationResult.invalid(tokenId, reason);
    }
}
