package gmail.toolkit.service;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.services.gmail.Gmail;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Per-invocation handle on an authenticated Gmail client, passed explicitly to every remote call.
 * Nothing is read from disk until the first remote call, so local validation always runs first.
 */
@Slf4j
public class GmailSession {
    private final String userId;
    private final Supplier<Credential> credentialLoader;
    private final TokenRefreshService tokenRefreshService;
    private final Function<Credential, Gmail> clientFactory;

    private Credential credential;
    private Gmail client;

    public GmailSession(String userId,
                        Supplier<Credential> credentialLoader,
                        TokenRefreshService tokenRefreshService,
                        Function<Credential, Gmail> clientFactory) {
        this.userId = userId;
        this.credentialLoader = credentialLoader;
        this.tokenRefreshService = tokenRefreshService;
        this.clientFactory = clientFactory;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Returns the Gmail client, loading the stored credential and refreshing it first if needed.
     * @throws gmail.toolkit.exception.MissingCredentialsException if setup has not been done
     * @throws gmail.toolkit.exception.AuthenticationException if the token cannot be refreshed
     */
    public Gmail client() {
        if (client == null) {
            credential = credentialLoader.get();
            tokenRefreshService.ensureValidAccessToken(credential);
            client = clientFactory.apply(credential);
            log.debug("Opened Gmail session for user {}", userId);
        }
        return client;
    }

    public Credential getCredential() {
        return credential;
    }

    public boolean isOpen() {
        return client != null;
    }
}
