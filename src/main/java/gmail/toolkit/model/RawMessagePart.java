package gmail.toolkit.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One node of a message's MIME tree as delivered by Gmail.
 * {@code bodyData} is still base64url-encoded; multipart containers usually have none.
 */
@Value
@Builder
public class RawMessagePart {
    String partId;
    String mimeType;
    String filename;
    @Singular
    List<MessageHeader> headers;
    String bodyData;
    Integer bodySize;
    @Singular
    List<RawMessagePart> parts;
}
