package gmail.toolkit.exception;

/**
 * A label operation failed, e.g. a duplicate name or an unknown label.
 */
public class LabelException extends GmailCommandException {

    public LabelException(String message) {
        super(ErrorType.LABEL_ERROR, message);
    }

    public LabelException(String message, Throwable cause) {
        super(ErrorType.LABEL_ERROR, message, cause);
    }
}
