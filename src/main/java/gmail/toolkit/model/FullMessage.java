package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@JsonPropertyOrder({"id", "threadId", "subject", "from", "to", "date", "snippet", "body"})
public class FullMessage extends MetadataMessage {
    private final String body;

    public FullMessage(MetadataMessage metadata, String body) {
        super(metadata.getId(), metadata.getThreadId(), metadata.getSubject(), metadata.getFrom(),
                metadata.getTo(), metadata.getDate(), metadata.getSnippet());
        this.body = body;
    }
}
