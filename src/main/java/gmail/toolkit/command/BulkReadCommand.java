package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.model.BulkReadRequest;
import gmail.toolkit.model.BulkReadResult;
import gmail.toolkit.model.Format;
import gmail.toolkit.service.BulkReadService;
import gmail.toolkit.service.GmailSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Component
@Command(name = "bulk-read", mixinStandardHelpOptions = true,
        description = "Search Gmail with automatic pagination, for result sets larger than 100 messages.")
public class BulkReadCommand extends AbstractGmailCommand {
    private final BulkReadService bulkReadService;

    @Option(names = "--query", required = true, description = "Gmail search query, e.g. \"newer_than:30d\".")
    String query;

    @Option(names = "--max-results", defaultValue = "500",
            description = "Maximum number of messages to return (default: ${DEFAULT-VALUE}).")
    int maxResults;

    @Option(names = "--format", defaultValue = "metadata",
            description = "minimal, metadata or full (default: ${DEFAULT-VALUE}).")
    Format format;

    @Option(names = "--output-file",
            description = "Write the JSON result to this file instead of stdout.")
    Path outputFile;

    public BulkReadCommand(GmailSessionFactory sessionFactory, JsonResponseWriter responseWriter,
                           BulkReadService bulkReadService) {
        super(sessionFactory, responseWriter);
        this.bulkReadService = bulkReadService;
    }

    @Override
    protected int execute() throws IOException {
        BulkReadRequest request = BulkReadRequest.builder()
            .query(query)
            .maxResults(maxResults)
            .format(format)
            .build();
        BulkReadResult result = bulkReadService.bulkSearch(sessionFactory.openSession(), request);
        if (outputFile != null) {
            responseWriter.writeSuccessToFile(result, outputFile);
            log.info("Saved {} messages to {}", result.getResultCount(), outputFile);
        } else {
            responseWriter.writeSuccess(result);
        }
        return EXIT_OK;
    }

    @Override
    protected ErrorType defaultErrorType() {
        return ErrorType.SEARCH_ERROR;
    }
}
