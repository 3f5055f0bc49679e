package gmail.toolkit.exception;

/**
 * Input rejected locally, before any request reaches Gmail.
 */
public class ValidationException extends GmailCommandException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorType.VALIDATION_ERROR, message, cause);
    }
}
