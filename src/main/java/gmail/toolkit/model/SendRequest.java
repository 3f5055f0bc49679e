package gmail.toolkit.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Exactly one of {@code body} and {@code bodyFile} must be set. Null lists are treated as empty.
 */
@Value
@Builder
public class SendRequest {
    List<String> to;
    String subject;
    String body;
    Path bodyFile;
    List<String> cc;
    List<String> bcc;
    List<Path> attachments;
}
