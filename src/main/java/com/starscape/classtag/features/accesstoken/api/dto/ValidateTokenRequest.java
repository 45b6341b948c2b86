package com.starscape.classtag.features.accesstoken.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ValidateTokenRequest(
    @NotBlank(message = "token is required")
    @Size(max = 128, message = "token is too long")
    String token
) {

    @Override
    public String toString() {
        return "ValidateTokenRequest[token=***]";
    }
}
