package gmail.toolkit.exception;

/**
 * Base class for every failure a command reports through the error envelope.
 * The message is what the caller sees, so provider messages are kept verbatim.
 */
public class GmailCommandException extends RuntimeException {
    private final ErrorType errorType;

    public GmailCommandException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public GmailCommandException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
