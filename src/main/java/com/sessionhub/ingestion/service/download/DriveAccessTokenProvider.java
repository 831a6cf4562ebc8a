package com.sessionhub.ingestion.service.download;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.sessionhub.ingestion.service.AcquisitionStrategyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Bearer tokens for the Drive API from Application Default Credentials. The credential is
 * loaded once and refreshed when it expires.
 */
@Component
public class DriveAccessTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(DriveAccessTokenProvider.class);
    static final String DRIVE_READONLY_SCOPE = "https://www.googleapis.com/auth/drive.readonly";

    private GoogleCredentials credentials;

    public synchronized String getAccessToken() {
        try {
            if (credentials == null) {
                credentials = GoogleCredentials.getApplicationDefault().createScoped(List.of(DRIVE_READONLY_SCOPE));
                logger.info("Loaded application default credentials for Drive access");
            }
            credentials.refreshIfExpired();
            AccessToken token = credentials.getAccessToken();
            if (token == null) {
                throw new AcquisitionStrategyException("Drive credentials returned no access token");
            }
            return token.getTokenValue();
        } catch (IOException e) {
            throw new AcquisitionStrategyException("Drive credentials are not available", e);
        }
    }
}
