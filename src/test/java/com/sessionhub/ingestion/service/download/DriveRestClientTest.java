package com.sessionhub.ingestion.service.download;

import com.google.common.util.concurrent.RateLimiter;
import com.sessionhub.ingestion.model.MimeTypes;
import com.sessionhub.ingestion.model.StoreFileMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class DriveRestClientTest {

    private static final String BASE = "https://drive.test/v3";

    @Mock
    private DriveAccessTokenProvider tokenProvider;

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private DriveRestClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new DriveRestClient(restTemplate, tokenProvider, RateLimiter.create(1000.0), BASE);
        when(tokenProvider.getAccessToken()).thenReturn("token-1");
    }

    @Test
    void readsMetadataWithBearerToken() {
        server.expect(requestTo(startsWith(BASE + "/files/DECK1?")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("fields", "id,name,mimeType,size"))
                .andExpect(queryParam("supportsAllDrives", "true"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
                .andRespond(withSuccess("{\"id\":\"DECK1\",\"name\":\"Keynote\","
                        + "\"mimeType\":\"application/vnd.google-apps.presentation\",\"kind\":\"drive#file\"}",
                        MediaType.APPLICATION_JSON));

        StoreFileMetadata metadata = client.getMetadata("DECK1");

        assertThat(metadata.name()).isEqualTo("Keynote");
        assertThat(metadata.isNativeFormat()).isTrue();
        assertThat(metadata.size()).isNull();
        server.verify();
    }

    @Test
    void exportsToTargetFile() throws Exception {
        Path target = tempDir.resolve("deck.part");
        byte[] body = "pptx-bytes".getBytes(StandardCharsets.UTF_8);
        server.expect(requestTo(startsWith(BASE + "/files/DECK1/export?")))
                .andExpect(queryParam("mimeType", MimeTypes.PPTX))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_OCTET_STREAM));

        long written = client.exportFile("DECK1", MimeTypes.PPTX, target);

        assertThat(written).isEqualTo(body.length);
        assertThat(Files.readAllBytes(target)).isEqualTo(body);
        server.verify();
    }

    @Test
    void downloadsMediaOfUploadedFile() {
        Path target = tempDir.resolve("file.part");
        server.expect(requestTo(startsWith(BASE + "/files/FILE1?")))
                .andExpect(queryParam("alt", "media"))
                .andRespond(withSuccess(new byte[]{1, 2, 3}, MediaType.APPLICATION_OCTET_STREAM));

        assertThat(client.downloadFile("FILE1", target)).isEqualTo(3L);
        server.verify();
    }

    @Test
    void forbiddenExportSurfacesAsClientError() {
        server.expect(requestTo("https://docs.google.com/presentation/d/BIG/export/pptx"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.fetchAuthenticated("https://docs.google.com/presentation/d/BIG/export/pptx",
                tempDir.resolve("big.part")))
                .isInstanceOf(HttpClientErrorException.Forbidden.class);
        server.verify();
    }
}
