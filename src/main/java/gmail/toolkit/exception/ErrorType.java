package gmail.toolkit.exception;

/**
 * Error categories reported in the {@code error_type} field of the JSON error envelope.
 */
public enum ErrorType {
    MISSING_CREDENTIALS("MissingCredentials"),
    AUTHENTICATION_ERROR("AuthenticationError"),
    VALIDATION_ERROR("ValidationError"),
    SEARCH_ERROR("SearchError"),
    SEND_ERROR("SendError"),
    LABEL_ERROR("LabelError"),
    MARK_READ_ERROR("MarkReadError");

    private final String wireName;

    ErrorType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
