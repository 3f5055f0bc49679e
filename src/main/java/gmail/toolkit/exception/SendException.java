package gmail.toolkit.exception;

/**
 * Gmail rejected a send request.
 */
public class SendException extends GmailCommandException {

    public SendException(String message) {
        super(ErrorType.SEND_ERROR, message);
    }

    public SendException(String message, Throwable cause) {
        super(ErrorType.SEND_ERROR, message, cause);
    }
}
