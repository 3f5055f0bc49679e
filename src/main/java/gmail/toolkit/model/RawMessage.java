package gmail.toolkit.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Typed, read-only view of a Gmail message. The payload is null for messages fetched in minimal format.
 */
@Value
@Builder
public class RawMessage {
    String id;
    String threadId;
    @Singular
    List<String> labelIds;
    String snippet;
    RawMessagePart payload;
}
