package com.starscape.classtag.features.accesstoken.api;

import com.starscape.classtag.features.accesstoken.app.AccessTokenSummary;
import com.starscape.classtag.features.accesstoken.app.ListAccessTokensHandler;
import com.starscape.classtag.features.accesstoken.app.TokenUsageStats;
import com.starscape.classtag.features.accesstoken.app.TokenUsageStatsHandler;
import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/queries/access-tokens")
public class AccessTokenQueryController {

    private final ListAccessTokensHandler listHandler;
    private final TokenUsageStatsHandler statsHandler;

    public AccessTokenQueryController(ListAccessTokensHandler listHandler, TokenUsageStatsHandler statsHandler) {
        this.listHandler = listHandler;
        this.statsHandler = statsHandler;
    }

    /**
     * GET /queries/access-tokens?scope=EVENT&resourceId=...
     */
    @GetMapping
    public ResponseEntity<List<AccessTokenSummary>> list(
            @RequestParam TokenScope scope,
            @RequestParam(required = false) UUID resourceId) {
        return ResponseEntity.ok(listHandler.handle(scope, resourceId));
    }

    @GetMapping("/{tokenId}/stats")
    public ResponseEntity<TokenUsageStats> stats(@PathVariable String tokenId) {
        return ResponseEntity.ok(statsHandler.handle(tokenId));
    }
}
