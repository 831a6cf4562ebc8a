package com.sessionhub.ingestion.service.storage;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.model.StoredObject;
import com.sessionhub.ingestion.service.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectAclRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores assets in S3 at {@code s3://<bucket>/<prefix>/<contentId>/<uuid><ext>}.
 *
 * <p>Access URLs are presigned GETs by default. If the ambient credentials cannot sign, the
 * alternate signing credentials are tried, and failing that the object is made public-read.
 * In public-assets mode objects are uploaded public-read and get their permanent URL.</p>
 */
@Service
public class S3StorageSink implements StorageSink {

    private static final Logger logger = LoggerFactory.getLogger(S3StorageSink.class);

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final Optional<S3Presigner> fallbackPresigner;
    private final String bucket;
    private final String prefix;
    private final boolean publicAssets;
    private final Duration signedUrlTtl;

    public S3StorageSink(S3Client s3Client,
                         S3Presigner presigner,
                         @Qualifier("fallbackS3Presigner") Optional<S3Presigner> fallbackPresigner,
                         @Value("${app.storage.bucket}") String bucket,
                         @Value("${app.storage.prefix:session-assets}") String prefix,
                         @Value("${app.storage.public-assets:false}") boolean publicAssets,
                         @Value("${app.storage.signed-url-hours:24}") long signedUrlHours) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.fallbackPresigner = fallbackPresigner;
        this.bucket = bucket;
        this.prefix = trimSlashes(prefix);
        this.publicAssets = publicAssets;
        this.signedUrlTtl = Duration.ofHours(Math.max(1, signedUrlHours));
    }

    @Override
    public StoredObject store(Path file, AssetEntry entry, UUID contentId) {
        String key = objectKey(entry, contentId);
        PutObjectRequest.Builder request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(entry.getMimeType() != null ? entry.getMimeType() : MimeTypes.OCTET_STREAM);
        if (publicAssets) {
            request.acl(ObjectCannedACL.PUBLIC_READ);
        }
        try {
            s3Client.putObject(request.build(), RequestBody.fromFile(file));
        } catch (SdkException e) {
            throw new StorageException("Failed to upload " + file.getFileName() + " to s3://" + bucket + "/" + key, e);
        }
        String location = "s3://" + bucket + "/" + key;
        logger.info("Uploaded asset for content {} to {}", contentId, location);

        String accessUrl = publicAssets ? publicUrl(key) : signedUrl(key);
        return new StoredObject(location, accessUrl);
    }

    private String objectKey(AssetEntry entry, UUID contentId) {
        String name = UUID.randomUUID() + MimeTypes.extensionFor(entry.getMimeType());
        return prefix.isEmpty()
                ? contentId + "/" + name
                : prefix + "/" + contentId + "/" + name;
    }

    private String signedUrl(String key) {
        try {
            return presign(presigner, key);
        } catch (SdkClientException e) {
            logger.warn("Could not sign URL for {} with ambient credentials: {}", key, e.getMessage());
        }
        if (fallbackPresigner.isPresent()) {
            try {
                return presign(fallbackPresigner.get(), key);
            } catch (SdkException e) {
                logger.warn("Could not sign URL for {} with alternate credentials: {}", key, e.getMessage());
            }
        }
        logger.warn("Falling back to a public URL for {}", key);
        makePublic(key);
        return publicUrl(key);
    }

    private String presign(S3Presigner signer, String key) {
        GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                .signatureDuration(signedUrlTtl)
                .getObjectRequest(get -> get.bucket(bucket).key(key))
                .build();
        return signer.presignGetObject(request).url().toString();
    }

    private void makePublic(String key) {
        try {
            s3Client.putObjectAcl(PutObjectAclRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .acl(ObjectCannedACL.PUBLIC_READ)
                    .build());
        } catch (SdkException e) {
            throw new StorageException("Could not make s3://" + bucket + "/" + key + " public", e);
        }
    }

    private String publicUrl(String key) {
        try {
            return s3Client.utilities()
                    .getUrl(GetUrlRequest.builder().bucket(bucket).key(key).build())
                    .toExternalForm();
        } catch (SdkException e) {
            throw new StorageException("Could not build public URL for s3://" + bucket + "/" + key, e);
        }
    }

    private static String trimSlashes(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
