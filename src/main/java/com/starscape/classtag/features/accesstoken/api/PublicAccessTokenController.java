package com.starscape.classtag.features.accesstoken.api;

import com.starscape.classtag.features.accesstoken.api.dto.ValidateTokenRequest;
import com.starscape.classtag.features.accesstoken.api.dto.ValidateTokenResponse;
import com.starscape.classtag.features.accesstoken.app.TokenValidationResult;
import com.starscape.classtag.features.accesstoken.app.ValidateAccessTokenHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Token check for families and course staff holding an access token. No staff login involved.
 */
@RestController
@RequestMapping("/public/access-tokens")
public class PublicAccessTokenController {

    private final ValidateAccessTokenHandler validateHandler;

    public PublicAccessTokenController(ValidateAccessTokenHandler validateHandler) {
        this.validateHandler = validateHandler;
    }

    /**
     * POST /public/access-tokens/validate
     * Every unusable token yields the same 401 response.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidateTokenResponse> validate(@Valid @RequestBody ValidateTokenRequest request) {
        TokenValidationResult result = validateHandler.requireValid(request.token());
        return ResponseEntity.ok(ValidateTokenResponse.from(result));
    }
}
