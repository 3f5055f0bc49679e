package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output projection of a message. Each value also names the Gmail API {@code format}
 * requested when fetching the message, so the provider never sends more than the projection needs.
 */
public enum Format {
    MINIMAL("minimal"),
    METADATA("metadata"),
    FULL("full");

    private final String value;

    Format(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getApiFormat() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
