package gmail.toolkit.exception;

/**
 * Gmail rejected a search, usually a malformed query.
 */
public class SearchException extends GmailCommandException {

    public SearchException(String message) {
        super(ErrorType.SEARCH_ERROR, message);
    }

    public SearchException(String message, Throwable cause) {
        super(ErrorType.SEARCH_ERROR, message, cause);
    }
}
