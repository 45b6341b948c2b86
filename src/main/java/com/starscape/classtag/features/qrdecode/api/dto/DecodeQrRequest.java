package com.starscape.classtag.features.qrdecode.api.dto;

import jakarta.validation.constraints.NotNull;

public record DecodeQrRequest(
    @NotNull(message = "qrCode is required")
    String qrCode
) {}
