package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;
import com.sessionhub.ingestion.service.AcquisitionStrategyException;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpRange;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;

/**
 * Downloads in fixed-size byte ranges after a HEAD for the total length. Each range is retried
 * on its own and appended to the target file.
 */
@Component
@Order(50)
public class HttpRangedStrategy extends AbstractHttpStrategy {

    private static final Logger logger = LoggerFactory.getLogger(HttpRangedStrategy.class);

    private final long chunkSize;

    public HttpRangedStrategy(RestTemplate restTemplate,
                              @Qualifier("assetDownloadRetry") Retry retry,
                              @Value("${app.drive.export-url-template:https://docs.google.com/presentation/d/%s/export/pptx}") String exportUrlTemplate,
                              @Value("${app.http.range-chunk-bytes:16777216}") long chunkSize) {
        super(restTemplate, retry, exportUrlTemplate);
        this.chunkSize = Math.max(1L, chunkSize);
    }

    @Override
    public String name() {
        return "http-ranged";
    }

    @Override
    public Optional<DownloadedAsset> attempt(AssetEntry entry, Path target) throws Exception {
        String url = resolveUrl(entry);
        if (url == null) {
            return Optional.empty();
        }
        URI uri = URI.create(url);
        HttpHeaders head = retry.executeCallable(() -> restTemplate.headForHeaders(uri));
        long total = head.getContentLength();
        if (total <= 0) {
            throw new AcquisitionStrategyException("Server did not report a content length for " + url);
        }

        Files.write(target, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        long chunks = (total + chunkSize - 1) / chunkSize;
        logger.debug("Fetching {} bytes from {} in {} ranges", total, url, chunks);
        for (long start = 0; start < total; start += chunkSize) {
            final long from = start;
            final long to = Math.min(start + chunkSize, total) - 1;
            byte[] chunk = retry.executeCallable(() -> fetchRange(uri, from, to));
            Files.write(target, chunk, StandardOpenOption.APPEND);
        }
        return Optional.of(new DownloadedAsset(target, total, mimeTypeFor(head.getContentType(), entry), null, name()));
    }

    private byte[] fetchRange(URI uri, long from, long to) {
        return restTemplate.execute(uri, HttpMethod.GET,
                request -> request.getHeaders().setRange(List.of(HttpRange.createByteRange(from, to))),
                response -> {
                    if (response.getStatusCode().value() != HttpStatus.PARTIAL_CONTENT.value()) {
                        throw new AcquisitionStrategyException("Server ignored range request for " + uri
                                + " (status " + response.getStatusCode().value() + ")");
                    }
                    byte[] bytes = StreamUtils.copyToByteArray(response.getBody());
                    long expected = to - from + 1;
                    if (bytes.length != expected) {
                        throw new IOException("Short range " + from + "-" + to + ": got " + bytes.length + " of " + expected + " bytes");
                    }
                    return bytes;
                });
    }
}
