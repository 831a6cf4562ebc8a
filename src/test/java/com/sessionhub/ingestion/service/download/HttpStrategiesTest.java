package com.sessionhub.ingestion.service.download;

import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.DownloadedAsset;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.model.SlotType;
import com.sessionhub.ingestion.service.AcquisitionStrategyException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpStrategiesTest {

    private static final String TEMPLATE = "https://files.test/d/%s/export";
    private static final String URL = "https://files.test/deck.pptx";
    private static final byte[] CONTENT = "0123456789".getBytes(StandardCharsets.US_ASCII);

    @TempDir
    Path tempDir;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private Retry retry;
    private Path target;

    @BeforeEach
    void setUp() throws Exception {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(Exception.class)
                .ignoreExceptions(HttpClientErrorException.NotFound.class, AcquisitionStrategyException.class)
                .build());
        target = Files.createFile(tempDir.resolve("asset.part"));
    }

    @Test
    void wholeFileDownloadsExportUrl() throws Exception {
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(CONTENT, MediaType.APPLICATION_OCTET_STREAM));

        Optional<DownloadedAsset> asset = wholeFile().attempt(deck().exportUrl(URL).build(), target);

        assertThat(asset).isPresent();
        assertThat(asset.get().size()).isEqualTo(10L);
        assertThat(asset.get().mimeType()).isEqualTo(MimeTypes.PPTX);
        assertThat(asset.get().strategyName()).isEqualTo("http-whole-file");
        assertThat(Files.readAllBytes(target)).isEqualTo(CONTENT);
        server.verify();
    }

    @Test
    void wholeFileRetriesServerErrors() throws Exception {
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL)).andRespond(withSuccess(CONTENT, MediaType.parseMediaType("application/pdf")));

        Optional<DownloadedAsset> asset = wholeFile().attempt(deck().accessUrl(URL).build(), target);

        assertThat(asset.get().mimeType()).isEqualTo("application/pdf");
        server.verify();
    }

    @Test
    void wholeFileDoesNotRetryMissingFile() {
        server.expect(requestTo(URL)).andRespond(withResourceNotFound());

        assertThatThrownBy(() -> wholeFile().attempt(deck().exportUrl(URL).build(), target))
                .isInstanceOf(HttpClientErrorException.NotFound.class);
        server.verify();
    }

    @Test
    void htmlResponseIsRejected() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>sign in</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> wholeFile().attempt(deck().exportUrl(URL).build(), target))
                .isInstanceOf(AcquisitionStrategyException.class)
                .hasMessageContaining("HTML");
        server.verify();
    }

    @Test
    void wholeFileFallsBackToTemplateForDeckId() throws Exception {
        server.expect(requestTo("https://files.test/d/DECK9/export"))
                .andRespond(withSuccess(CONTENT, MediaType.APPLICATION_OCTET_STREAM));

        assertThat(wholeFile().attempt(deck().externalId("DECK9").build(), target)).isPresent();
        server.verify();
    }

    @Test
    void wholeFileSkipsEntryWithoutAnyLink() throws Exception {
        AssetEntry folder = AssetEntry.builder().slotType(SlotType.FOLDER_LINK).externalId("F1").build();

        assertThat(wholeFile().attempt(folder, target)).isEmpty();
        server.verify();
    }

    @Test
    void rangedDownloadRetriesSingleRange() throws Exception {
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.HEAD))
                .andRespond(withSuccess().headers(lengthHeaders(10)));
        server.expect(requestTo(URL)).andExpect(header(HttpHeaders.RANGE, "bytes=0-3"))
                .andRespond(withStatus(HttpStatus.PARTIAL_CONTENT).body(Arrays.copyOfRange(CONTENT, 0, 4)));
        server.expect(requestTo(URL)).andExpect(header(HttpHeaders.RANGE, "bytes=4-7"))
                .andRespond(withServerError());
        server.expect(requestTo(URL)).andExpect(header(HttpHeaders.RANGE, "bytes=4-7"))
                .andRespond(withStatus(HttpStatus.PARTIAL_CONTENT).body(Arrays.copyOfRange(CONTENT, 4, 8)));
        server.expect(requestTo(URL)).andExpect(header(HttpHeaders.RANGE, "bytes=8-9"))
                .andRespond(withStatus(HttpStatus.PARTIAL_CONTENT).body(Arrays.copyOfRange(CONTENT, 8, 10)));

        Optional<DownloadedAsset> asset = ranged(4).attempt(deck().exportUrl(URL).build(), target);

        assertThat(asset.get().size()).isEqualTo(10L);
        assertThat(asset.get().strategyName()).isEqualTo("http-ranged");
        assertThat(Files.readAllBytes(target)).isEqualTo(CONTENT);
        server.verify();
    }

    @Test
    void rangedDownloadFailsWhenServerIgnoresRange() {
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.HEAD))
                .andRespond(withSuccess().headers(lengthHeaders(10)));
        server.expect(requestTo(URL)).andRespond(withSuccess(CONTENT, MediaType.APPLICATION_OCTET_STREAM));

        assertThatThrownBy(() -> ranged(4).attempt(deck().exportUrl(URL).build(), target))
                .isInstanceOf(AcquisitionStrategyException.class)
                .hasMessageContaining("status 200");
        server.verify();
    }

    @Test
    void rangedDownloadNeedsContentLength() {
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.HEAD)).andRespond(withSuccess());

        assertThatThrownBy(() -> ranged(4).attempt(deck().exportUrl(URL).build(), target))
                .isInstanceOf(AcquisitionStrategyException.class)
                .hasMessageContaining("content length");
        server.verify();
    }

    @Test
    void cookieStrategySkipsWithoutCookie() throws Exception {
        HttpCookieStrategy strategy = new HttpCookieStrategy(restTemplate, retry, TEMPLATE, " ");

        assertThat(strategy.attempt(deck().exportUrl(URL).build(), target)).isEmpty();
        server.verify();
    }

    @Test
    void cookieStrategySendsConfiguredCookie() throws Exception {
        server.expect(requestTo(URL)).andExpect(header(HttpHeaders.COOKIE, "SID=abc"))
                .andRespond(withSuccess(CONTENT, MediaType.APPLICATION_OCTET_STREAM));
        HttpCookieStrategy strategy = new HttpCookieStrategy(restTemplate, retry, TEMPLATE, "SID=abc");

        Optional<DownloadedAsset> asset = strategy.attempt(deck().exportUrl(URL).build(), target);

        assertThat(asset.get().strategyName()).isEqualTo("http-cookie");
        server.verify();
    }

    private HttpWholeFileStrategy wholeFile() {
        return new HttpWholeFileStrategy(restTemplate, retry, TEMPLATE);
    }

    private HttpRangedStrategy ranged(long chunkSize) {
        return new HttpRangedStrategy(restTemplate, retry, TEMPLATE, chunkSize);
    }

    private static HttpHeaders lengthHeaders(long length) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentLength(length);
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        return headers;
    }

    private static AssetEntry.AssetEntryBuilder deck() {
        return AssetEntry.builder().slotType(SlotType.PRIMARY_DECK);
    }
}
