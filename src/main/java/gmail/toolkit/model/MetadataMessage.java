package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@JsonPropertyOrder({"id", "threadId", "subject", "from", "to", "date", "snippet"})
public class MetadataMessage extends MinimalMessage {
    private final String subject;
    private final String from;
    private final String to;
    private final String date;
    private final String snippet;

    public MetadataMessage(String id, String threadId, String subject, String from, String to,
                           String date, String snippet) {
        super(id, threadId);
        this.subject = subject;
        this.from = from;
        this.to = to;
        this.date = date;
        this.snippet = snippet;
    }
}
