package com.starscape.classtag.features.downloads.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record DownloadRequest(
    @NotBlank(message = "token is required")
    @Size(max = 128, message = "token is too long")
    String token,

    @NotNull(message = "photoId is required")
    UUID photoId
) {

    @Override
    public String toString() {
        return "DownloadRequest[token=***, photoId=" + photoId + "]";
    }
}
