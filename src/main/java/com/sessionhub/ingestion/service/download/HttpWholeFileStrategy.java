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

@Component
@Order(40)
public class HttpWholeFileStrategy extends AbstractHttpStrategy {

    public HttpWholeFileStrategy(RestTemplate restTemplate,
                                 @Qualifier("assetDownloadRetry") Retry retry,
                                 @Value("${app.drive.export-url-template:https://docs.google.com/presentation/d/%s/export/pptx}") String exportUrlTemplate) {
        super(restTemplate, retry, exportUrlTemplate);
    }

    @Override
    public String name() {
        return "http-whole-file";
    }

    @Override
    public Optional<DownloadedAsset> attempt(AssetEntry entry, Path target) throws Exception {
        String url = resolveUrl(entry);
        if (url == null) {
            return Optional.empty();
        }
        FetchedBody body = fetchWhole(url, target, new HttpHeaders());
        return Optional.of(new DownloadedAsset(target, body.size(), mimeTypeFor(body.contentType(), entry), null, name()));
    }
}
