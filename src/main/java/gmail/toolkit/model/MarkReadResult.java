package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"action", "query", "affected_messages", "message"})
public class MarkReadResult {
    public static final String ACTION = "mark_as_read";

    String action;
    String query;
    @JsonProperty("affected_messages")
    int affectedMessages;
    String message;

    public static MarkReadResult of(String query, int affectedMessages) {
        return new MarkReadResult(ACTION, query, affectedMessages, null);
    }

    public static MarkReadResult nothingFound(String query) {
        return new MarkReadResult(ACTION, query, 0, "No messages found matching query");
    }
}
