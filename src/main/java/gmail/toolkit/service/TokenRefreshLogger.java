package gmail.toolkit.service;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.auth.oauth2.CredentialRefreshListener;
import com.google.api.client.auth.oauth2.TokenErrorResponse;
import com.google.api.client.auth.oauth2.TokenResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class TokenRefreshLogger implements CredentialRefreshListener {

    @Override
    public void onTokenResponse(Credential credential, TokenResponse tokenResponse) {
        log.info("Access token refreshed, expires in {}s", tokenResponse.getExpiresInSeconds());
    }

    @Override
    public void onTokenErrorResponse(Credential credential, TokenErrorResponse tokenErrorResponse) {
        String error = tokenErrorResponse != null ? tokenErrorResponse.getError() : "unknown";
        log.warn("Access token refresh rejected: {}", error);
    }
}
