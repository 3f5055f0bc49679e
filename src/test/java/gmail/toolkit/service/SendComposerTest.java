package gmail.toolkit.service;

import com.google.api.services.gmail.model.Message;
import gmail.toolkit.exception.AuthenticationException;
import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.exception.SendException;
import gmail.toolkit.exception.ValidationException;
import gmail.toolkit.model.SendRequest;
import gmail.toolkit.model.SendResult;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SendComposerTest {
    private static final long LIMIT = SendComposer.DEFAULT_MAX_ATTACHMENT_BYTES;

    @Mock
    private GmailApiService gmailApiService;

    @Mock
    private GmailSession session;

    @TempDir
    Path tempDir;

    private SendComposer sendComposer;

    @BeforeEach
    void setUp() {
        sendComposer = new SendComposer(gmailApiService, new AddressValidator(), LIMIT);
    }

    @Test
    void send_WithInvalidRecipient_ShouldRejectWithoutRemoteCall() {
        // Given
        SendRequest request = SendRequest.builder()
            .to(List.of("not-an-email"))
            .subject("Hello")
            .body("Hi")
            .build();

        // When
        ValidationException exception = assertThrows(ValidationException.class,
                () -> sendComposer.send(session, request));

        // Then
        assertEquals(ErrorType.VALIDATION_ERROR, exception.getErrorType());
        assertTrue(exception.getMessage().contains("not-an-email"));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void send_WithInvalidCcAddress_ShouldReject() {
        // Given
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com"))
            .cc(List.of("broken@"))
            .subject("Hello")
            .body("Hi")
            .build();

        // When / Then
        assertThrows(ValidationException.class, () -> sendComposer.send(session, request));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void send_WithNoRecipients_ShouldReject() {
        // Given
        SendRequest request = SendRequest.builder().to(List.of()).subject("Hello").body("Hi").build();

        // When / Then
        assertThrows(ValidationException.class, () -> sendComposer.send(session, request));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void send_WithBodyAndBodyFile_ShouldReject() throws IOException {
        // Given
        Path bodyFile = Files.writeString(tempDir.resolve("body.txt"), "from file");
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("Hello")
            .body("inline")
            .bodyFile(bodyFile)
            .build();

        // When / Then
        assertThrows(ValidationException.class, () -> sendComposer.send(session, request));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void send_WithNeitherBodyNorBodyFile_ShouldReject() {
        // Given
        SendRequest request = SendRequest.builder().to(List.of("user@example.com")).subject("Hello").build();

        // When / Then
        assertThrows(ValidationException.class, () -> sendComposer.send(session, request));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void send_WithMissingBodyFile_ShouldReject() {
        // Given
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("Hello")
            .bodyFile(tempDir.resolve("missing.txt"))
            .build();

        // When / Then
        assertThrows(ValidationException.class, () -> sendComposer.send(session, request));
    }

    @Test
    void send_WithDirectoryAsBodyFile_ShouldRejectWithoutRemoteCall() {
        // Given
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("Hello")
            .bodyFile(tempDir)
            .build();

        // When
        ValidationException exception = assertThrows(ValidationException.class,
                () -> sendComposer.send(session, request));

        // Then
        assertEquals(ErrorType.VALIDATION_ERROR, exception.getErrorType());
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void send_WithMissingAttachment_ShouldReject() {
        // Given
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("Hello")
            .body("Hi")
            .attachments(List.of(tempDir.resolve("missing.pdf")))
            .build();

        // When
        ValidationException exception = assertThrows(ValidationException.class,
                () -> sendComposer.send(session, request));

        // Then
        assertTrue(exception.getMessage().contains("missing.pdf"));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void validate_WithAttachmentsExactlyAtLimit_ShouldPass() throws IOException {
        // Given
        Path attachment = sparseFile("exact.bin", LIMIT);
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("Big")
            .body("see attached")
            .attachments(List.of(attachment))
            .build();

        // When / Then
        assertDoesNotThrow(() -> sendComposer.validate(request));
    }

    @Test
    void send_WithAttachmentsOverLimit_ShouldRejectWithoutRemoteCall() throws IOException {
        // Given
        Path first = sparseFile("first.bin", LIMIT / 2);
        Path second = sparseFile("second.bin", LIMIT / 2 + 1);
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("Too big")
            .body("see attached")
            .attachments(List.of(first, second))
            .build();

        // When
        ValidationException exception = assertThrows(ValidationException.class,
                () -> sendComposer.send(session, request));

        // Then
        assertTrue(exception.getMessage().contains("exceeds"));
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void send_WithValidRequest_ShouldSendEncodedMimeMessage() throws Exception {
        // Given
        when(gmailApiService.sendMessage(eq(session), anyString()))
            .thenReturn(new Message().setId("sent-1").setThreadId("thread-9"));
        SendRequest request = SendRequest.builder()
            .to(List.of("user@example.com", " Jane Doe <jane@example.com>"))
            .cc(List.of("cc@example.com"))
            .subject("Grüße")
            .body("Hello there")
            .build();

        // When
        SendResult result = sendComposer.send(session, request);

        // Then
        assertEquals("sent-1", result.getMessageId());
        assertEquals("thread-9", result.getThreadId());
        assertEquals(List.of("user@example.com", "Jane Doe <jane@example.com>"), result.getTo());
        assertEquals("Grüße", result.getSubject());

        ArgumentCaptor<String> rawCaptor = ArgumentCaptor.forClass(String.class);
        verify(gmailApiService).sendMessage(eq(session), rawCaptor.capture());
        String raw = rawCaptor.getValue();
        assertFalse(raw.contains("="), "base64url without padding");
        assertFalse(raw.contains("+") || raw.contains("/"));

        MimeMessage mime = parse(raw);
        assertEquals("Grüße", mime.getSubject());
        assertEquals(2, mime.getRecipients(jakarta.mail.Message.RecipientType.TO).length);
        assertEquals("jane@example.com",
                ((InternetAddress) mime.getRecipients(jakarta.mail.Message.RecipientType.TO)[1]).getAddress());
        assertEquals("cc@example.com", mime.getRecipients(jakarta.mail.Message.RecipientType.CC)[0].toString());
        assertEquals("Hello there", ((String) mime.getContent()).trim());
    }

    @Test
    void send_WithoutThreadIdInResponse_ShouldUseMessageId() throws IOException {
        // Given
        when(gmailApiService.sendMessage(eq(session), anyString())).thenReturn(new Message().setId("sent-2"));

        // When
        SendResult result = sendComposer.send(session, SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("Hi")
            .body("Body")
            .build());

        // Then
        assertEquals("sent-2", result.getThreadId());
    }

    @Test
    void send_WithBodyFileAndAttachment_ShouldBuildMultipartMessage() throws Exception {
        // Given
        Path bodyFile = Files.writeString(tempDir.resolve("body.txt"), "Body from file", StandardCharsets.UTF_8);
        Path attachment = Files.writeString(tempDir.resolve("notes.txt"), "attachment content");
        when(gmailApiService.sendMessage(eq(session), anyString())).thenReturn(new Message().setId("sent-3"));

        // When
        sendComposer.send(session, SendRequest.builder()
            .to(List.of("user@example.com"))
            .subject("With attachment")
            .bodyFile(bodyFile)
            .attachments(List.of(attachment))
            .build());

        // Then
        ArgumentCaptor<String> rawCaptor = ArgumentCaptor.forClass(String.class);
        verify(gmailApiService).sendMessage(eq(session), rawCaptor.capture());
        MimeMessage mime = parse(rawCaptor.getValue());
        MimeMultipart multipart = (MimeMultipart) mime.getContent();
        assertEquals(2, multipart.getCount());
        assertEquals("Body from file", ((String) multipart.getBodyPart(0).getContent()).trim());
        assertEquals("notes.txt", multipart.getBodyPart(1).getFileName());
    }

    @Test
    void send_WithProviderRejection_ShouldRaiseSendError() throws IOException {
        // Given
        when(gmailApiService.sendMessage(eq(session), anyString()))
            .thenThrow(GmailApiErrors.jsonError(400, "Invalid To header"));

        // When
        SendException exception = assertThrows(SendException.class, () -> sendComposer.send(session,
                SendRequest.builder().to(List.of("user@example.com")).subject("Hi").body("Body").build()));

        // Then
        assertEquals(ErrorType.SEND_ERROR, exception.getErrorType());
        assertEquals("Invalid To header", exception.getMessage());
    }

    @Test
    void send_WithForbiddenResponse_ShouldRaiseAuthenticationError() throws IOException {
        // Given
        when(gmailApiService.sendMessage(eq(session), anyString()))
            .thenThrow(GmailApiErrors.jsonError(403, "Insufficient Permission"));

        // When / Then
        assertThrows(AuthenticationException.class, () -> sendComposer.send(session,
                SendRequest.builder().to(List.of("user@example.com")).subject("Hi").body("Body").build()));
    }

    private Path sparseFile(String name, long length) throws IOException {
        Path path = tempDir.resolve(name);
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "rw")) {
            file.setLength(length);
        }
        return path;
    }

    private static MimeMessage parse(String raw) throws Exception {
        byte[] bytes = Base64.getUrlDecoder().decode(raw);
        return new MimeMessage(Session.getInstance(new Properties()), new ByteArrayInputStream(bytes));
    }
}
