package gmail.toolkit.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartBody;
import com.google.api.services.gmail.model.MessagePartHeader;
import gmail.toolkit.model.RawMessage;
import gmail.toolkit.model.RawMessagePart;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RawMessageMapperTest {

    @Test
    void fromApi_WithNestedParts_ShouldKeepTreeAndHeaderOrder() {
        // Given
        MessagePart plain = new MessagePart()
            .setPartId("0.0")
            .setMimeType("text/plain")
            .setBody(new MessagePartBody().setData("SGVsbG8").setSize(5));
        MessagePart attachment = new MessagePart()
            .setPartId("1")
            .setMimeType("application/pdf")
            .setFilename("invoice.pdf")
            .setBody(new MessagePartBody().setAttachmentId("att-1").setSize(2048));
        Message message = new Message()
            .setId("m1")
            .setThreadId("t1")
            .setLabelIds(List.of("INBOX", "UNREAD"))
            .setSnippet("Hello")
            .setPayload(new MessagePart()
                .setMimeType("multipart/mixed")
                .setHeaders(List.of(
                    new MessagePartHeader().setName("Subject").setValue("Invoice"),
                    new MessagePartHeader().setName("Received").setValue("first"),
                    new MessagePartHeader().setName("Received").setValue("second")))
                .setParts(List.of(
                    new MessagePart().setPartId("0").setMimeType("multipart/alternative").setParts(List.of(plain)),
                    attachment)));

        // When
        RawMessage raw = RawMessageMapper.fromApi(message);

        // Then
        assertEquals("m1", raw.getId());
        assertEquals(List.of("INBOX", "UNREAD"), raw.getLabelIds());
        RawMessagePart payload = raw.getPayload();
        assertEquals(3, payload.getHeaders().size());
        assertEquals("second", payload.getHeaders().get(2).getValue());
        assertEquals(2, payload.getParts().size());
        RawMessagePart mappedPlain = payload.getParts().get(0).getParts().get(0);
        assertEquals("SGVsbG8", mappedPlain.getBodyData());
        assertEquals(5, mappedPlain.getBodySize());
        RawMessagePart mappedAttachment = payload.getParts().get(1);
        assertEquals("invoice.pdf", mappedAttachment.getFilename());
        assertNull(mappedAttachment.getBodyData());
    }

    @Test
    void fromApi_WithMinimalMessage_ShouldHaveNoPayload() {
        // When
        RawMessage raw = RawMessageMapper.fromApi(new Message().setId("m2").setThreadId("t2"));

        // Then
        assertNull(raw.getPayload());
        assertTrue(raw.getLabelIds().isEmpty());
        assertNull(raw.getSnippet());
    }
}
