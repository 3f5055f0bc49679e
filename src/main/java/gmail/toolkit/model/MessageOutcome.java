package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Result of modifying the labels of one message inside a batch.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"message_id", "status", "error"})
public class MessageOutcome {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    @JsonProperty("message_id")
    String messageId;
    String status;
    String error;

    public static MessageOutcome success(String messageId) {
        return new MessageOutcome(messageId, SUCCESS, null);
    }

    public static MessageOutcome failure(String messageId, String error) {
        return new MessageOutcome(messageId, ERROR, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
