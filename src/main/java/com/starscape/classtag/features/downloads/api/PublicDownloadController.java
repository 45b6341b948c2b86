package com.starscape.classtag.features.downloads.api;

import com.starscape.classtag.features.downloads.api.dto.DownloadRequest;
import com.starscape.classtag.features.downloads.api.dto.DownloadUrlResponse;
import com.starscape.classtag.features.downloads.app.IssueDownloadUrlHandler;
import com.starscape.classtag.features.downloads.app.StorageSigner;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for generating presigned download URLs for access-token holders.
 */
@RestController
@RequestMapping("/public/downloads")
public class PublicDownloadController {

    private final IssueDownloadUrlHandler downloadHandler;

    public PublicDownloadController(IssueDownloadUrlHandler downloadHandler) {
        this.downloadHandler = downloadHandler;
    }

    /**
     * POST /public/downloads
     */
    @PostMapping
    public ResponseEntity<DownloadUrlResponse> issueDownloadUrl(@Valid @RequestBody DownloadRequest request) {
        StorageSigner.SignedUrl signed = downloadHandler.handle(request.token(), request.photoId());
        return ResponseEntity.ok(new DownloadUrlResponse(signed.url(), signed.expiresInSeconds()));
    }
}
