package com.sessionhub.ingestion.service.download;

import com.google.common.util.concurrent.RateLimiter;
import com.sessionhub.ingestion.model.StoreFileMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Drive v3 over REST. Every call is throttled by the shared Drive rate limiter.
 */
@Component
public class DriveRestClient implements StructuredStoreClient {

    private static final Logger logger = LoggerFactory.getLogger(DriveRestClient.class);
    private static final String METADATA_FIELDS = "id,name,mimeType,size";

    private final RestTemplate restTemplate;
    private final DriveAccessTokenProvider tokenProvider;
    private final RateLimiter rateLimiter;
    private final String apiBaseUrl;

    public DriveRestClient(@Qualifier("driveRestTemplate") RestTemplate restTemplate,
                           DriveAccessTokenProvider tokenProvider,
                           @Qualifier("driveRateLimiter") RateLimiter rateLimiter,
                           @Value("${app.drive.api-base-url:https://www.googleapis.com/drive/v3}") String apiBaseUrl) {
        this.restTemplate = restTemplate;
        this.tokenProvider = tokenProvider;
        this.rateLimiter = rateLimiter;
        this.apiBaseUrl = apiBaseUrl;
    }

    @Override
    public StoreFileMetadata getMetadata(String fileId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
                .path("/files/{id}")
                .queryParam("fields", METADATA_FIELDS)
                .queryParam("supportsAllDrives", true)
                .buildAndExpand(fileId)
                .encode()
                .toUri();
        acquirePermit();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenProvider.getAccessToken());
        StoreFileMetadata metadata = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers),
                StoreFileMetadata.class).getBody();
        logger.debug("Drive metadata for {}: {}", fileId, metadata);
        return metadata;
    }

    @Override
    public long exportFile(String fileId, String targetMimeType, Path target) {
        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
                .path("/files/{id}/export")
                .queryParam("mimeType", targetMimeType)
                .buildAndExpand(fileId)
                .encode()
                .toUri();
        return streamTo(uri, target);
    }

    @Override
    public long downloadFile(String fileId, Path target) {
        URI uri = UriComponentsBuilder.fromHttpUrl(apiBaseUrl)
                .path("/files/{id}")
                .queryParam("alt", "media")
                .queryParam("supportsAllDrives", true)
                .buildAndExpand(fileId)
                .encode()
                .toUri();
        return streamTo(uri, target);
    }

    @Override
    public long fetchAuthenticated(String url, Path target) {
        return streamTo(URI.create(url), target);
    }

    private long streamTo(URI uri, Path target) {
        acquirePermit();
        String token = tokenProvider.getAccessToken();
        Long written = restTemplate.execute(uri, HttpMethod.GET,
                request -> request.getHeaders().setBearerAuth(token),
                response -> {
                    try (InputStream body = response.getBody()) {
                        return Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                });
        return written == null ? 0L : written;
    }

    @SuppressWarnings("UnstableApiUsage")
    private void acquirePermit() {
        double waited = rateLimiter.acquire();
        if (waited > 0) {
            logger.debug("Waited {}s for Drive rate limiter", waited);
        }
    }
}
