package com.starscape.classtag.features.accesstoken.api;

import com.starscape.classtag.common.security.UserPrincipal;
import com.starscape.classtag.features.accesstoken.api.dto.IssueAccessTokenRequest;
import com.starscape.classtag.features.accesstoken.app.AccessTokenSummary;
import com.starscape.classtag.features.accesstoken.app.IssueAccessTokenCommand;
import com.starscape.classtag.features.accesstoken.app.IssueAccessTokenHandler;
import com.starscape.classtag.features.accesstoken.app.IssuedAccessToken;
import com.starscape.classtag.features.accesstoken.app.RevokeAccessTokenHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for access token issuance and revocation.
 */
@RestController
@RequestMapping("/commands/access-tokens")
public class AccessTokenController {

    private final IssueAccessTokenHandler issueHandler;
    private final RevokeAccessTokenHandler revokeHandler;

    public AccessTokenController(
            IssueAccessTokenHandler issueHandler,
            RevokeAccessTokenHandler revokeHandler) {
        this.issueHandler = issueHandler;
        this.revokeHandler = revokeHandler;
    }

    /**
     * Issue a token. The plaintext is only present in this response.
     * POST /commands/access-tokens
     */
    @PostMapping
    public ResponseEntity<IssuedAccessToken> issue(
            @Valid @RequestBody IssueAccessTokenRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {

        IssueAccessTokenCommand command = new IssueAccessTokenCommand(
            request.scope(),
            request.resourceId(),
            request.accessLevel(),
            request.canDownload(),
            request.maxUses(),
            request.expiresAt()
        );
        IssuedAccessToken issued = issueHandler.handle(command, principal.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(issued);
    }

    /**
     * POST /commands/access-tokens/{tokenId}/revoke
     */
    @PostMapping("/{tokenId}/revoke")
    public ResponseEntity<AccessTokenSummary> revoke(@PathVariable String tokenId) {
        return ResponseEntity.ok(revokeHandler.handle(tokenId));
    }
}
