package com.starscape.classtag.features.downloads.infra;

import com.starscape.classtag.features.downloads.app.StorageSigner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.time.Duration;

@Service
public class S3StorageSigner implements StorageSigner {

    private final S3Presigner s3Presigner;
    private final String bucket;

    public S3StorageSigner(
            S3Presigner s3Presigner,
            @Value("${aws.s3.bucket}") String bucket) {
        this.s3Presigner = s3Presigner;
        this.bucket = bucket;
    }

    @Override
    public SignedUrl signDownload(String storagePath, String filename, Duration validity) {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(storagePath)
                .responseContentDisposition("attachment; filename=\"" + filename.replace("\"", "") + "\"")
                .build();

        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(validity)
                .getObjectRequest(getRequest)
                .build();

        PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
        return new SignedUrl(presigned.url().toString(), validity.toSeconds());
    }
}
