package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.service.AcquisitionStrategyException;
import io.github.resilience4j.retry.Retry;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Base for the plain HTTP strategies. Every network call goes through the shared retry with
 * exponential backoff and jitter.
 */
public abstract class AbstractHttpStrategy implements AcquisitionStrategy {

    protected final RestTemplate restTemplate;
    protected final Retry retry;
    private final String exportUrlTemplate;

    protected AbstractHttpStrategy(RestTemplate restTemplate, Retry retry, String exportUrlTemplate) {
        this.restTemplate = restTemplate;
        this.retry = retry;
        this.exportUrlTemplate = exportUrlTemplate;
    }

    /**
     * The best directly downloadable link of the entry, or null.
     */
    protected String resolveUrl(AssetEntry entry) {
        if (entry.getExportUrl() != null) {
            return entry.getExportUrl();
        }
        if (entry.getAccessUrl() != null) {
            return entry.getAccessUrl();
        }
        if (entry.getExternalId() != null && entry.getSlotType().isDeck()) {
            return String.format(exportUrlTemplate, entry.getExternalId());
        }
        return null;
    }

    /**
     * GETs the whole body into {@code target}, retrying the full request on failure.
     */
    protected FetchedBody fetchWhole(String url, Path target, HttpHeaders extraHeaders) throws Exception {
        URI uri = URI.create(url);
        return retry.executeCallable(() -> restTemplate.execute(uri, HttpMethod.GET,
                request -> request.getHeaders().addAll(extraHeaders),
                response -> {
                    rejectHtml(response, url);
                    try (InputStream body = response.getBody()) {
                        long written = Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                        return new FetchedBody(written, response.getHeaders().getContentType());
                    }
                }));
    }

    protected void rejectHtml(ClientHttpResponse response, String url) {
        MediaType contentType = response.getHeaders().getContentType();
        if (contentType != null && MediaType.TEXT_HTML.isCompatibleWith(contentType)) {
            throw new AcquisitionStrategyException("Received an HTML page instead of file content from " + url);
        }
    }

    protected String mimeTypeFor(MediaType contentType, AssetEntry entry) {
        if (contentType == null || MediaType.APPLICATION_OCTET_STREAM.isCompatibleWith(contentType)) {
            return MimeTypes.defaultFor(entry.getSlotType());
        }
        return contentType.getType() + "/" + contentType.getSubtype();
    }

    protected record FetchedBody(long size, MediaType contentType) {
    }
}
