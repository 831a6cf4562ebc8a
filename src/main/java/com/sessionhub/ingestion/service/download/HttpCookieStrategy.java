package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Last resort: a plain GET carrying a configured browser session cookie. Skipped when no cookie is set.
 */
@Component
@Order(60)
public class HttpCookieStrategy extends AbstractHttpStrategy {

    private final String sessionCookie;

    public HttpCookieStrategy(RestTemplate restTemplate,
                              @Qualifier("assetDownloadRetry") Retry retry,
                              @Value("${app.drive.export-url-template:https://docs.google.com/presentation/d/%s/export/pptx}") String exportUrlTemplate,
                              @Value("${app.http.session-cookie:}") String sessionCookie) {
        super(restTemplate, retry, exportUrlTemplate);
        this.sessionCookie = sessionCookie;
    }

    @Override
    public String name() {
        return "http-cookie";
    }

    @Override
    public Optional<DownloadedAsset> attempt(AssetEntry entry, Path target) throws Exception {
        if (sessionCookie == null || sessionCookie.isBlank()) {
            return Optional.empty();
        }
        String url = resolveUrl(entry);
        if (url == null) {
            return Optional.empty();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.COOKIE, sessionCookie.trim());
        FetchedBody body = fetchWhole(url, target, headers);
        return Optional.of(new DownloadedAsset(target, body.size(), mimeTypeFor(body.contentType(), entry), null, name()));
    }
}
