package gmail.toolkit.service;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.util.Sleeper;
import com.google.api.services.gmail.Gmail;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class GmailSessionFactory {
    private final OAuthTokenService oauthTokenService;
    private final TokenRefreshService tokenRefreshService;
    private final RetryPolicy retryPolicy;
    private final NetHttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final Sleeper sleeper;
    private final String applicationName;
    private final String userId;

    public GmailSessionFactory(
            OAuthTokenService oauthTokenService,
            TokenRefreshService tokenRefreshService,
            RetryPolicy retryPolicy,
            NetHttpTransport httpTransport,
            JsonFactory jsonFactory,
            Sleeper sleeper,
            @Value("${gmail.application-name:Gmail Toolkit}") String applicationName,
            @Value("${gmail.user-id:me}") String userId) {
        this.oauthTokenService = oauthTokenService;
        this.tokenRefreshService = tokenRefreshService;
        this.retryPolicy = retryPolicy;
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.sleeper = sleeper;
        this.applicationName = applicationName;
        this.userId = userId;
    }

    public GmailSession openSession() {
        return new GmailSession(userId, oauthTokenService::loadCredential, tokenRefreshService, this::buildClient);
    }

    Gmail buildClient(Credential credential) {
        return new Gmail.Builder(httpTransport, jsonFactory,
                new RetryingRequestInitializer(credential, retryPolicy, sleeper))
            .setApplicationName(applicationName)
            .build();
    }
}
