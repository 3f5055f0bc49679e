package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"id", "threadId"})
public class MinimalMessage implements ProjectedMessage {
    private final String id;
    private final String threadId;

    public MinimalMessage(String id, String threadId) {
        this.id = id;
        this.threadId = threadId;
    }
}
