package gmail.toolkit.exception;

/**
 * OAuth client secrets or the stored token are missing. Run the {@code auth} command first.
 */
public class MissingCredentialsException extends GmailCommandException {

    public MissingCredentialsException(String message) {
        super(ErrorType.MISSING_CREDENTIALS, message);
    }

    public MissingCredentialsException(String message, Throwable cause) {
        super(ErrorType.MISSING_CREDENTIALS, message, cause);
    }
}
