package gmail.toolkit.service;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.auth.oauth2.TokenResponseException;
import gmail.toolkit.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Slf4j
@Service
public class TokenRefreshService {
    private final long refreshSkewSeconds;

    public TokenRefreshService(@Value("${gmail.token.refresh-skew-seconds:300}") long refreshSkewSeconds) {
        this.refreshSkewSeconds = refreshSkewSeconds;
    }

    /**
     * Refreshes the access token if it is missing, has no expiry, or expires within the refresh skew.
     * Expiry is measured with the credential's own clock.
     * @return the same credential, holding a usable access token
     * @throws AuthenticationException if a refresh is needed and cannot be done
     */
    public Credential ensureValidAccessToken(Credential credential) {
        Long expiresIn = credential.getExpiresInSeconds();
        boolean needsRefresh = credential.getAccessToken() == null
            || expiresIn == null
            || expiresIn <= refreshSkewSeconds;

        if (!needsRefresh) {
            return credential;
        }

        if (credential.getRefreshToken() == null || credential.getRefreshToken().isEmpty()) {
            throw new AuthenticationException(
                "Access token expired and no refresh token available. Run the auth command again.");
        }

        try {
            log.info("Refreshing access token (expires in {}s)", expiresIn);
            if (!credential.refreshToken()) {
                throw new AuthenticationException("Token endpoint did not return a new access token");
            }
            return credential;
        } catch (TokenResponseException e) {
            String reason = e.getDetails() != null && e.getDetails().getError() != null
                ? e.getDetails().getError()
                : e.getMessage();
            log.error("Failed to refresh access token: {}", reason);
            throw new AuthenticationException("Failed to refresh access token: " + reason, e);
        } catch (IOException e) {
            log.error("Failed to refresh access token: {}", e.getMessage(), e);
            throw new AuthenticationException("Failed to refresh access token: " + e.getMessage(), e);
        }
    }
}
