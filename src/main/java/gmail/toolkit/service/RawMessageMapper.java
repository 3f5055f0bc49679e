package gmail.toolkit.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import gmail.toolkit.model.MessageHeader;
import gmail.toolkit.model.RawMessage;
import gmail.toolkit.model.RawMessagePart;

/**
 * The one place where Gmail's JSON model is read. Everything downstream works on {@link RawMessage}.
 */
public final class RawMessageMapper {

    private RawMessageMapper() {
    }

    public static RawMessage fromApi(Message message) {
        RawMessage.RawMessageBuilder builder = RawMessage.builder()
            .id(message.getId())
            .threadId(message.getThreadId())
            .snippet(message.getSnippet());
        if (message.getLabelIds() != null) {
            builder.labelIds(message.getLabelIds());
        }
        if (message.getPayload() != null) {
            builder.payload(fromApi(message.getPayload()));
        }
        return builder.build();
    }

    public static RawMessagePart fromApi(MessagePart part) {
        RawMessagePart.RawMessagePartBuilder builder = RawMessagePart.builder()
            .partId(part.getPartId())
            .mimeType(part.getMimeType())
            .filename(part.getFilename());
        if (part.getHeaders() != null) {
            for (MessagePartHeader header : part.getHeaders()) {
                builder.header(MessageHeader.of(header.getName(), header.getValue()));
            }
        }
        if (part.getBody() != null) {
            builder.bodyData(part.getBody().getData())
                .bodySize(part.getBody().getSize());
        }
        if (part.getParts() != null) {
            for (MessagePart child : part.getParts()) {
                builder.part(fromApi(child));
            }
        }
        return builder.build();
    }
}
