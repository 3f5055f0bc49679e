package gmail.toolkit.exception;

/**
 * The access token is invalid or expired and could not be refreshed.
 */
public class AuthenticationException extends GmailCommandException {

    public AuthenticationException(String message) {
        super(ErrorType.AUTHENTICATION_ERROR, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorType.AUTHENTICATION_ERROR, message, cause);
    }
}
