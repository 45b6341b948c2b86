package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.common.config.TokenProperties;
import com.starscape.classtag.features.accesstoken.domain.AccessTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Scheduled job that permanently deletes tokens revoked or expired more than
 * app.tokens.retention-days ago.
 */
@Service
public class TokenRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(TokenRetentionJob.class);

    private final AccessTokenRepository tokenRepository;
    private final TokenProperties tokenProperties;
    private final Clock clock;

    public TokenRetentionJob(AccessTokenRepository tokenRepository, TokenProperties tokenProperties, Clock clock) {
        this.tokenRepository = tokenRepository;
        this.tokenProperties = tokenProperties;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.tokens.retention-cron:0 30 3 * * *}")
    @Transactional
    public int purgeRetiredTokens() {
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(tokenProperties.getRetentionDays()));
        int deleted = tokenRepository.deleteRetiredBefore(cutoff);
        if (deleted > 0) {
            log.info("Deleted {} access tokens retired before {}", deleted, cutoff);
        } else {
            log.debug("No retired access tokens before {}", cutoff);
        }
        return deleted;
    }
}
