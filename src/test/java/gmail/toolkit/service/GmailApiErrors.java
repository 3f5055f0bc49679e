package gmail.toolkit.service;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;

/**
 * Builds the exceptions the Gmail client throws for non-2xx responses.
 */
final class GmailApiErrors {

    private GmailApiErrors() {
    }

    static GoogleJsonResponseException jsonError(int status, String message) {
        GoogleJsonError details = new GoogleJsonError();
        details.setCode(status);
        details.setMessage(message);
        return new GoogleJsonResponseException(
            new HttpResponseException.Builder(status, "HTTP " + status, new HttpHeaders()), details);
    }
}
