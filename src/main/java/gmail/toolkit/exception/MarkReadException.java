package gmail.toolkit.exception;

public class MarkReadException extends GmailCommandException {

    public MarkReadException(String message) {
        super(ErrorType.MARK_READ_ERROR, message);
    }

    public MarkReadException(String message, Throwable cause) {
        super(ErrorType.MARK_READ_ERROR, message, cause);
    }
}
