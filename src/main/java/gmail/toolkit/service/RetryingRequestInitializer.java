package gmail.toolkit.service;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpUnsuccessfulResponseHandler;
import com.google.api.client.util.Sleeper;
import gmail.toolkit.model.RetryDecision;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Authenticates every Gmail request with the credential and retries failures according to {@link RetryPolicy}.
 * A 401 is offered to the credential first, which refreshes the token and replays the request.
 */
@Slf4j
public class RetryingRequestInitializer implements HttpRequestInitializer {
    private final Credential credential;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RetryingRequestInitializer(Credential credential, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.credential = credential;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public void initialize(HttpRequest request) throws IOException {
        credential.initialize(request);
        request.setUnsuccessfulResponseHandler(new PolicyResponseHandler());
    }

    private class PolicyResponseHandler implements HttpUnsuccessfulResponseHandler {
        private int attempt = 1;

        @Override
        public boolean handleResponse(HttpRequest request, HttpResponse response, boolean supportsRetry)
                throws IOException {
            if (credential.handleResponse(request, response, supportsRetry)) {
                return true;
            }
            if (!supportsRetry) {
                return false;
            }
            RetryDecision decision = retryPolicy.decide(response.getStatusCode(), attempt);
            if (!decision.isRetry()) {
                return false;
            }
            log.warn("Gmail returned {} on attempt {}, retrying in {} ms",
                    response.getStatusCode(), attempt, decision.getDelayMs());
            try {
                sleeper.sleep(decision.getDelayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting to retry Gmail request");
            }
            attempt++;
            return true;
        }
    }
}
