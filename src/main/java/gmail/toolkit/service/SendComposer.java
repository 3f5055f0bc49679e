package gmail.toolkit.service;

import com.google.api.services.gmail.model.Message;
import gmail.toolkit.exception.SendException;
import gmail.toolkit.exception.ValidationException;
import gmail.toolkit.model.SendRequest;
import gmail.toolkit.model.SendResult;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Validates a send request, builds the MIME message and hands it to Gmail.
 */
@Slf4j
@Service
public class SendComposer {
    public static final long DEFAULT_MAX_ATTACHMENT_BYTES = 25L * 1024 * 1024;
    private static final String UTF_8 = "UTF-8";

    private final GmailApiService gmailApiService;
    private final AddressValidator addressValidator;
    private final long maxAttachmentBytes;

    public SendComposer(
            GmailApiService gmailApiService,
            AddressValidator addressValidator,
            @Value("${gmail.send.max-attachment-bytes:26214400}") long maxAttachmentBytes) {
        this.gmailApiService = gmailApiService;
        this.addressValidator = addressValidator;
        this.maxAttachmentBytes = maxAttachmentBytes;
    }

    /**
     * Sends the message. Every local check in {@link #validate(SendRequest)} runs before any remote call.
     * @throws ValidationException if the request is malformed
     * @throws SendException if Gmail rejects the message
     */
    public SendResult send(GmailSession session, SendRequest request) {
        validate(request);

        String raw;
        try {
            raw = encode(buildMimeMessage(request, resolveBody(request)));
        } catch (MessagingException | IOException e) {
            log.error("Failed to compose message: {}", e.getMessage(), e);
            throw new SendException("Failed to compose message: " + e.getMessage(), e);
        }

        try {
            log.info("Sending message to {} recipient(s)", request.getTo().size());
            Message sent = gmailApiService.sendMessage(session, raw);
            // a new message starts its own thread
            String threadId = sent.getThreadId() != null ? sent.getThreadId() : sent.getId();
            log.info("Sent message {}", sent.getId());
            return new SendResult(sent.getId(), threadId, trimmed(request.getTo()), request.getSubject());
        } catch (IOException e) {
            log.warn("Send failed: {}", e.getMessage());
            throw ProviderErrors.translate(e, SendException::new);
        }
    }

    public void validate(SendRequest request) {
        List<String> to = nullToEmpty(request.getTo());
        if (to.isEmpty()) {
            throw new ValidationException("At least one recipient is required");
        }
        boolean hasBody = request.getBody() != null;
        boolean hasBodyFile = request.getBodyFile() != null;
        if (hasBody == hasBodyFile) {
            throw new ValidationException("Exactly one of body or body-file must be provided");
        }
        if (hasBodyFile && (!Files.isRegularFile(request.getBodyFile()) || !Files.isReadable(request.getBodyFile()))) {
            throw new ValidationException("Body file not found or not readable: " + request.getBodyFile());
        }

        List<String> invalid = new ArrayList<>();
        for (List<String> addresses : List.of(to, nullToEmpty(request.getCc()), nullToEmpty(request.getBcc()))) {
            for (String address : addresses) {
                if (!addressValidator.isValid(address)) {
                    invalid.add(address);
                }
            }
        }
        if (!invalid.isEmpty()) {
            throw new ValidationException("Invalid email address(es): " + String.join(", ", invalid));
        }

        long totalBytes = 0;
        for (Path attachment : nullToEmpty(request.getAttachments())) {
            if (!Files.isRegularFile(attachment) || !Files.isReadable(attachment)) {
                throw new ValidationException("Attachment not found or not readable: " + attachment);
            }
            try {
                totalBytes += Files.size(attachment);
            } catch (IOException e) {
                throw new ValidationException("Could not read size of attachment " + attachment, e);
            }
        }
        if (totalBytes > maxAttachmentBytes) {
            throw new ValidationException("Total attachment size " + totalBytes
                + " bytes exceeds the limit of " + maxAttachmentBytes + " bytes");
        }
    }

    MimeMessage buildMimeMessage(SendRequest request, String body) throws MessagingException, IOException {
        MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
        message.setRecipients(jakarta.mail.Message.RecipientType.TO, toAddresses(request.getTo()));
        if (!nullToEmpty(request.getCc()).isEmpty()) {
            message.setRecipients(jakarta.mail.Message.RecipientType.CC, toAddresses(request.getCc()));
        }
        if (!nullToEmpty(request.getBcc()).isEmpty()) {
            message.setRecipients(jakarta.mail.Message.RecipientType.BCC, toAddresses(request.getBcc()));
        }
        message.setSubject(request.getSubject() != null ? request.getSubject() : "", UTF_8);

        List<Path> attachments = nullToEmpty(request.getAttachments());
        if (attachments.isEmpty()) {
            message.setText(body, UTF_8);
        } else {
            MimeMultipart multipart = new MimeMultipart("mixed");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(body, UTF_8);
            multipart.addBodyPart(textPart);
            for (Path attachment : attachments) {
                MimeBodyPart filePart = new MimeBodyPart();
                filePart.attachFile(attachment.toFile(), contentTypeOf(attachment), "base64");
                multipart.addBodyPart(filePart);
            }
            message.setContent(multipart);
        }
        message.saveChanges();
        return message;
    }

    static String encode(MimeMessage message) throws MessagingException, IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        message.writeTo(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.toByteArray());
    }

    private String resolveBody(SendRequest request) throws IOException {
        if (request.getBody() != null) {
            return request.getBody();
        }
        return Files.readString(request.getBodyFile(), StandardCharsets.UTF_8);
    }

    private InternetAddress[] toAddresses(List<String> addresses) {
        List<InternetAddress> parsed = new ArrayList<>();
        for (String address : addresses) {
            parsed.add(addressValidator.parse(address));
        }
        return parsed.toArray(new InternetAddress[0]);
    }

    private static String contentTypeOf(Path path) throws IOException {
        String contentType = Files.probeContentType(path);
        return contentType != null ? contentType : "application/octet-stream";
    }

    private static List<String> trimmed(List<String> addresses) {
        List<String> result = new ArrayList<>();
        for (String address : addresses) {
            result.add(address.trim());
        }
        return result;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
