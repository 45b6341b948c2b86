package com.starscape.classtag.features.downloads.app;

import java.time.Duration;

/**
 * Produces short-lived URLs for stored objects.
 */
public interface StorageSigner {

    SignedUrl signDownload(String storagePath, String filename, Duration validity);

    record SignedUrl(String url, long expiresInSeconds) {}
}
