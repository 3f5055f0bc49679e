package gmail.toolkit.service;

import gmail.toolkit.model.Format;
import gmail.toolkit.model.FullMessage;
import gmail.toolkit.model.MessageHeader;
import gmail.toolkit.model.MetadataMessage;
import gmail.toolkit.model.MinimalMessage;
import gmail.toolkit.model.ProjectedMessage;
import gmail.toolkit.model.RawMessage;
import gmail.toolkit.model.RawMessagePart;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Reduces a {@link RawMessage} to one of the three output shapes. No I/O.
 */
@Slf4j
@Component
public class MessageProjector {
    static final String PLAIN_TEXT = "text/plain";

    public ProjectedMessage project(RawMessage raw, Format format) {
        switch (format) {
            case MINIMAL:
                return new MinimalMessage(raw.getId(), raw.getThreadId());
            case METADATA:
                return metadata(raw);
            case FULL:
                return new FullMessage(metadata(raw), plainTextBody(raw.getPayload()));
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    private MetadataMessage metadata(RawMessage raw) {
        RawMessagePart payload = raw.getPayload();
        return new MetadataMessage(
            raw.getId(),
            raw.getThreadId(),
            header(payload, "Subject"),
            header(payload, "From"),
            header(payload, "To"),
            header(payload, "Date"),
            raw.getSnippet() != null ? raw.getSnippet() : "");
    }

    /**
     * Case-sensitive lookup in the top-level headers; the first match wins, absence yields "".
     */
    static String header(RawMessagePart payload, String name) {
        if (payload == null) {
            return "";
        }
        for (MessageHeader header : payload.getHeaders()) {
            if (name.equals(header.getName())) {
                return header.getValue() != null ? header.getValue() : "";
            }
        }
        return "";
    }

    /**
     * Decoded content of the first text/plain part in depth-first order, starting at the payload itself.
     */
    static String plainTextBody(RawMessagePart payload) {
        RawMessagePart part = findFirst(payload, PLAIN_TEXT);
        if (part == null || part.getBodyData() == null) {
            return "";
        }
        return decode(part.getBodyData());
    }

    private static RawMessagePart findFirst(RawMessagePart part, String mimeType) {
        if (part == null) {
            return null;
        }
        if (mimeType.equals(part.getMimeType())) {
            return part;
        }
        for (RawMessagePart child : part.getParts()) {
            RawMessagePart found = findFirst(child, mimeType);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    static String decode(String data) {
        try {
            // Gmail uses URL-safe Base64
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                String padded = data;
                int remainder = padded.length() % 4;
                if (remainder > 0) {
                    padded += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Could not decode text/plain body: {}", e2.getMessage());
                return "";
            }
        }
    }
}
