package gmail.toolkit.service;

import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import gmail.toolkit.exception.AuthenticationException;
import gmail.toolkit.exception.GmailCommandException;

import java.io.IOException;
import java.util.function.BiFunction;

/**
 * Translates Gmail client failures into command exceptions, keeping the provider's message verbatim.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static int statusOf(IOException e) {
        return e instanceof HttpResponseException ? ((HttpResponseException) e).getStatusCode() : -1;
    }

    static String messageOf(IOException e) {
        if (e instanceof GoogleJsonResponseException) {
            GoogleJsonResponseException jsonError = (GoogleJsonResponseException) e;
            if (jsonError.getDetails() != null && jsonError.getDetails().getMessage() != null) {
                return jsonError.getDetails().getMessage();
            }
        }
        if (e instanceof HttpResponseException) {
            HttpResponseException httpError = (HttpResponseException) e;
            if (httpError.getContent() != null && !httpError.getContent().isEmpty()) {
                return httpError.getContent();
            }
            return httpError.getStatusCode() + " " + httpError.getStatusMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static boolean isAuthenticationFailure(IOException e) {
        int status = statusOf(e);
        return status == 401 || status == 403;
    }

    /**
     * 401/403 become {@link AuthenticationException}; everything else goes through {@code fallback}.
     */
    static GmailCommandException translate(IOException e,
                                           BiFunction<String, Throwable, ? extends GmailCommandException> fallback) {
        if (isAuthenticationFailure(e)) {
            return new AuthenticationException(messageOf(e), e);
        }
        return fallback.apply(messageOf(e), e);
    }
}
