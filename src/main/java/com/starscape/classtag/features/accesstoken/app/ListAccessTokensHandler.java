package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Lists tokens granted on a resource, newest first.
 */
@Service
public class ListAccessTokensHandler {

    private final AccessTokenRepository tokenRepository;
    private final Clock clock;

    public ListAccessTokensHandler(AccessTokenRepository tokenRepository, Clock clock) {
        this.tokenRepository = tokenRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AccessTokenSummary> handle(TokenScope scope, UUID resourceId) {
        if (scope == null) {
            throw new IllegalArgumentException("scope is required");
        }
        Instant now = Instant.now(clock);
        var tokens = resourceId != null
                ? tokenRepository.findByScopeAndResourceIdOrderByCreatedAtDesc(scope, resourceId)
                : tokenRepository.findByScopeOrderByCreatedAtDesc(scope);

        return tokens.stream()
                .map(token -> AccessTokenSummary.from(token, now))
                .collect(Collectors.toList());
    }
}
