package com.starscape.classtag.features.downloads.api.dto;

public record DownloadUrlResponse(
    String url,
    long expiresIn
) {}
