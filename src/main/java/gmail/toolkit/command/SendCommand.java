package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.model.SendRequest;
import gmail.toolkit.model.SendResult;
import gmail.toolkit.service.GmailSessionFactory;
import gmail.toolkit.service.SendComposer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@Command(name = "send", mixinStandardHelpOptions = true, description = "Send an email through Gmail.")
public class SendCommand extends AbstractGmailCommand {
    private final SendComposer sendComposer;

    @Option(names = "--to", required = true, split = ",", description = "Comma-separated recipient addresses.")
    List<String> to;

    @Option(names = "--subject", required = true, description = "Subject line.")
    String subject;

    @Option(names = "--body", description = "Plain-text body. Mutually exclusive with --body-file.")
    String body;

    @Option(names = "--body-file", description = "Read the plain-text body from this file.")
    Path bodyFile;

    @Option(names = "--cc", split = ",", description = "Comma-separated CC addresses.")
    List<String> cc = new ArrayList<>();

    @Option(names = "--bcc", split = ",", description = "Comma-separated BCC addresses.")
    List<String> bcc = new ArrayList<>();

    @Option(names = "--attach", description = "File to attach. Repeat for several files (25 MB total).")
    List<Path> attachments = new ArrayList<>();

    public SendCommand(GmailSessionFactory sessionFactory, JsonResponseWriter responseWriter,
                       SendComposer sendComposer) {
        super(sessionFactory, responseWriter);
        this.sendComposer = sendComposer;
    }

    @Override
    protected int execute() {
        SendRequest request = SendRequest.builder()
            .to(CsvValues.clean(to))
            .subject(subject)
            .body(body)
            .bodyFile(bodyFile)
            .cc(CsvValues.clean(cc))
            .bcc(CsvValues.clean(bcc))
            .attachments(attachments)
            .build();
        SendResult result = sendComposer.send(sessionFactory.openSession(), request);
        responseWriter.writeSuccess(result);
        return EXIT_OK;
    }

    @Override
    protected ErrorType defaultErrorType() {
        return ErrorType.SEND_ERROR;
    }
}
