package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.model.Format;
import gmail.toolkit.model.SearchRequest;
import gmail.toolkit.model.SearchResult;
import gmail.toolkit.service.GmailSessionFactory;
import gmail.toolkit.service.QueryNormalizer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Component
@Command(name = "read", mixinStandardHelpOptions = true,
        description = "Search Gmail and print the matching messages as JSON.")
public class ReadCommand extends AbstractGmailCommand {
    private final QueryNormalizer queryNormalizer;

    @Option(names = "--query", required = true,
            description = "Gmail search query, e.g. \"is:unread from:user@example.com\". "
                + "Supports the same operators as the Gmail search box.")
    String query;

    @Option(names = "--max-results", defaultValue = "10",
            description = "Number of messages to return, 1-100 (default: ${DEFAULT-VALUE}).")
    int maxResults;

    @Option(names = "--format", defaultValue = "metadata",
            description = "minimal (ids), metadata (headers and snippet) or full (adds the plain-text body). "
                + "Default: ${DEFAULT-VALUE}.")
    Format format;

    public ReadCommand(GmailSessionFactory sessionFactory, JsonResponseWriter responseWriter,
                       QueryNormalizer queryNormalizer) {
        super(sessionFactory, responseWriter);
        this.queryNormalizer = queryNormalizer;
    }

    @Override
    protected int execute() {
        SearchRequest request = SearchRequest.builder()
            .query(query)
            .maxResults(maxResults)
            .format(format)
            .build();
        SearchResult result = queryNormalizer.search(sessionFactory.openSession(), request);
        responseWriter.writeSuccess(result);
        return EXIT_OK;
    }

    @Override
    protected ErrorType defaultErrorType() {
        return ErrorType.SEARCH_ERROR;
    }
}
