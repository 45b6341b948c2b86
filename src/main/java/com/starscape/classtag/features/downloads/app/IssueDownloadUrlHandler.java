package com.starscape.classtag.features.downloads.app;

import com.starscape.classtag.common.audit.AuditAction;
import com.starscape.classtag.common.audit.AuditLogService;
import com.starscape.classtag.common.exception.NotFoundException;
import com.starscape.classtag.features.accesstoken.app.TokenResourceResolver;
import com.starscape.classtag.features.accesstoken.app.TokenValidationResult;
import com.starscape.classtag.features.accesstoken.app.ValidateAccessTokenHandler;
import com.starscape.classtag.features.photos.domain.Photo;
import com.starscape.classtag.features.photos.domain.PhotoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Handler for issuing a download URL to an access-token holder.
 *
 * The photo must be approved, stored, inside the token's resource, and the
 * token must allow downloads. Any of those failing is reported as a missing
 * photo so token holders cannot discover photos outside their scope.
 */
@Service
public class IssueDownloadUrlHandler {

    private static final Logger log = LoggerFactory.getLogger(IssueDownloadUrlHandler.class);

    static final String PHOTO_NOT_FOUND = "Photo not found";

    private final ValidateAccessTokenHandler validateHandler;
    private final TokenResourceResolver resourceResolver;
    private final PhotoRepository photoRepository;
    private final StorageSigner storageSigner;
    private final AuditLogService auditLogService;
    private final Duration urlValidity;

    public IssueDownloadUrlHandler(
            ValidateAccessTokenHandler validateHandler,
            TokenResourceResolver resourceResolver,
            PhotoRepository photoRepository,
            StorageSigner storageSigner,
            AuditLogService auditLogService,
            @Value("${aws.s3.download-url-minutes:5}") long urlValidityMinutes) {
        this.validateHandler = validateHandler;
        this.resourceResolver = resourceResolver;
        this.photoRepository = photoRepository;
        this.storageSigner = storageSigner;
        this.auditLogService = auditLogService;
        this.urlValidity = Duration.ofMinutes(urlValidityMinutes);
    }

    @Transactional
    public StorageSigner.SignedUrl handle(String presentedToken, UUID photoId) {
        TokenValidationResult token = validateHandler.requireValid(presentedToken);

        Photo photo = photoRepository.findById(photoId)
                .filter(Photo::isApproved)
                .filter(found -> found.getStoragePath() != null)
                .filter(found -> token.canDownload())
                .filter(found -> resourceResolver.covers(token.scope(), token.resourceId(), found))
                .orElseThrow(() -> {
                    log.info("Download refused for token {} and photo {}", token.tokenId(), photoId);
                    auditLogService.failure(AuditAction.DOWNLOAD_URL_ISSUED, token.tokenId(),
                            Map.of("photoId", photoId.toString()));
                    return new NotFoundException(PHOTO_NOT_FOUND);
                });

        StorageSigner.SignedUrl signed = storageSigner.signDownload(photo.getStoragePath(), photo.getFilename(), urlValidity);
        auditLogService.success(AuditAction.DOWNLOAD_URL_ISSUED, token.tokenId(),
                Map.of("photoId", photoId.toString(), "scope", token.scope().name()));
        return signed;
    }
}
