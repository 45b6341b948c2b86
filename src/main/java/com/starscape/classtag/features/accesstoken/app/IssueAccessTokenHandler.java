package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.config.TokenProperties;
import com.starscape.classtag.common.exception.NotFoundException;
import com.starscape.classtag.features.accesstoken.domain.AccessLevel;
import com.starscape.classtag.features.accesstoken.domain.AccessToken;
import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Handler for issuing a scoped access token.
 * Defaults to read-only, no download, expiring after app.tokens.default-expiry-days.
 */
@Service
public class IssueAccessTokenHandler {

    private static final Logger log = LoggerFactory.getLogger(IssueAccessTokenHandler.class);

    private final AccessTokenRepository tokenRepository;
    private final TokenResourceResolver resourceResolver;
    private final TokenCrypto tokenCrypto;
    private final AuditLogService auditLogService;
    private final TokenProperties tokenProperties;
    private final Clock clock;

    public IssueAccessTokenHandler(
            AccessTokenRepository tokenRepository,
            TokenResourceResolver resourceResolver,
            TokenCrypto tokenCrypto,
            AuditLogService auditLogService,
            TokenProperties tokenProperties,
            Clock clock) {
        this.tokenRepository = tokenRepository;
        this.resourceResolver = resourceResolver;
        this.tokenCrypto = tokenCrypto;
        this.auditLogService = auditLogService;
        this.tokenProperties = tokenProperties;
        this.clock = clock;
    }

    @Transactional
    public IssuedAccessToken handle(IssueAccessTokenCommand command, String issuedBy) {
        Instant now = Instant.now(clock);

        if (command.maxUses() != null && command.maxUses() <= 0) {
            throw new IllegalArgumentException("maxUses must be greater than 0");
        }
        Instant expiresAt = command.expiresAt() != null
                ? command.expiresAt()
                : now.plus(Duration.ofDays(tokenProperties.getDefaultExpiryDays()));
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("expiresAt must be in the future");
        }
        if (!resourceResolver.exists(command.scope(), command.resourceId())) {
            throw new NotFoundException("Resource not found for " + command.scope().getResourceKind() + " scope");
        }

        TokenCrypto.GeneratedToken generated = tokenCrypto.generate(command.scope());
        String tokenId = "tok_" + UUID.randomUUID().toString().replace("-", "");
        AccessLevel accessLevel = command.accessLevel() != null ? command.accessLevel() : AccessLevel.READ_ONLY;
        boolean canDownload = Boolean.TRUE.equals(command.canDownload());

        AccessToken token = new AccessToken(
            tokenId,
            command.scope(),
            command.resourceId(),
            accessLevel,
            canDownload,
            generated.hash(),
            generated.salt(),
            generated.prefix(),
            command.maxUses(),
            expiresAt,
            issuedBy,
            now
        );
        tokenRepository.save(token);

        String masked = TokenCrypto.mask(generated.prefix());
        log.info("Issued {} token {} ({}) for {} {}", command.scope(), tokenId, masked,
                command.scope().getResourceKind(), command.resourceId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scope", command.scope().name());
        details.put("resourceId", command.resourceId().toString());
        details.put("accessLevel", accessLevel.name());
        details.put("canDownload", canDownload);
        details.put("maxUses", command.maxUses());
        details.put("expiresAt", expiresAt.toString());
        auditLogService.success(AuditAction.TOKEN_ISSUED, tokenId, details);

        return new IssuedAccessToken(
            tokenId,
            generated.plaintext(),
            masked,
            command.scope(),
            command.resourceId(),
            accessLevel,
            canDownload,
            command.maxUses(),
            expiresAt
        );
    }
}
