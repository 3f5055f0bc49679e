package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.model.MarkReadRequest;
import gmail.toolkit.service.GmailSessionFactory;
import gmail.toolkit.service.MarkReadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Component
@Command(name = "mark-read", mixinStandardHelpOptions = true,
        description = "Mark every message matching a query as read.")
public class MarkReadCommand extends AbstractGmailCommand {
    private final MarkReadService markReadService;

    @Option(names = "--query", required = true, description = "Gmail search query, e.g. \"is:unread before:2024/03/01\".")
    String query;

    @Option(names = "--max-results", defaultValue = "500",
            description = "Maximum number of messages to process (default: ${DEFAULT-VALUE}).")
    int maxResults;

    @Option(names = "--batch-size", defaultValue = "100",
            description = "Messages per batch request, 1-1000 (default: ${DEFAULT-VALUE}).")
    int batchSize;

    public MarkReadCommand(GmailSessionFactory sessionFactory, JsonResponseWriter responseWriter,
                           MarkReadService markReadService) {
        super(sessionFactory, responseWriter);
        this.markReadService = markReadService;
    }

    @Override
    protected int execute() {
        MarkReadRequest request = MarkReadRequest.builder()
            .query(query)
            .maxResults(maxResults)
            .batchSize(batchSize)
            .build();
        responseWriter.writeSuccess(markReadService.markAsRead(sessionFactory.openSession(), request));
        return EXIT_OK;
    }

    @Override
    protected ErrorType defaultErrorType() {
        return ErrorType.MARK_READ_ERROR;
    }
}
