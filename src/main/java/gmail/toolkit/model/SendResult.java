package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

@Value
@JsonPropertyOrder({"message_id", "thread_id", "to", "subject"})
public class SendResult {
    @JsonProperty("message_id")
    String messageId;
    @JsonProperty("thread_id")
    String threadId;
    List<String> to;
    String subject;
}
