package gmail.toolkit.service;

import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import gmail.toolkit.exception.SearchException;
import gmail.toolkit.exception.ValidationException;
import gmail.toolkit.model.Format;
import gmail.toolkit.model.ProjectedMessage;
import gmail.toolkit.model.RawMessage;
import gmail.toolkit.model.SearchRequest;
import gmail.toolkit.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a Gmail search and projects the results.
 * The query string goes to Gmail untouched: operators such as {@code is:}, {@code newer_than:},
 * {@code { }} grouping and {@code -} exclusion are evaluated by the provider only.
 */
@Slf4j
@Service
public class QueryNormalizer {
    private final GmailApiService gmailApiService;
    private final MessageProjector messageProjector;

    public QueryNormalizer(GmailApiService gmailApiService, MessageProjector messageProjector) {
        this.gmailApiService = gmailApiService;
        this.messageProjector = messageProjector;
    }

    /**
     * Lists matching messages once, then fetches each one in the provider's order.
     * @throws ValidationException if maxResults is outside [1, 100] or the query is missing
     * @throws SearchException if Gmail rejects the query; the provider's message is kept verbatim
     * @throws gmail.toolkit.exception.AuthenticationException on 401/403 that could not be recovered
     */
    public SearchResult search(GmailSession session, SearchRequest request) {
        validate(request);
        int maxResults = request.getMaxResults() != null ? request.getMaxResults() : SearchRequest.DEFAULT_MAX_RESULTS;
        Format format = request.getFormat() != null ? request.getFormat() : Format.METADATA;

        log.info("Searching for '{}' (maxResults={}, format={})", request.getQuery(), maxResults, format);
        try {
            ListMessagesResponse response = gmailApiService.listMessages(session, request.getQuery(), maxResults, null);
            List<String> ids = new ArrayList<>();
            if (response.getMessages() != null) {
                for (Message ref : response.getMessages()) {
                    if (ids.size() >= maxResults) {
                        break;
                    }
                    ids.add(ref.getId());
                }
            }
            List<ProjectedMessage> messages = fetchProjected(session, ids, format);
            log.info("Search returned {} message(s)", messages.size());
            return new SearchResult(messages.size(), request.getQuery(), messages);
        } catch (IOException e) {
            log.warn("Search for '{}' failed: {}", request.getQuery(), e.getMessage());
            throw ProviderErrors.translate(e, SearchException::new);
        }
    }

    public ProjectedMessage project(RawMessage raw, Format format) {
        return messageProjector.project(raw, format);
    }

    /**
     * Fetches each message by id and projects it, preserving the order of {@code ids}.
     */
    public List<ProjectedMessage> fetchProjected(GmailSession session, List<String> ids, Format format)
            throws IOException {
        List<ProjectedMessage> messages = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            Message message = gmailApiService.getMessage(session, ids.get(i), format);
            messages.add(project(RawMessageMapper.fromApi(message), format));
            if ((i + 1) % 50 == 0) {
                log.info("Fetched {}/{} messages", i + 1, ids.size());
            }
        }
        return messages;
    }

    static void validate(SearchRequest request) {
        if (request.getQuery() == null) {
            throw new ValidationException("query is required");
        }
        Integer maxResults = request.getMaxResults();
        if (maxResults != null
                && (maxResults < SearchRequest.MIN_MAX_RESULTS || maxResults > SearchRequest.MAX_MAX_RESULTS)) {
            throw new ValidationException("max-results must be between " + SearchRequest.MIN_MAX_RESULTS
                + " and " + SearchRequest.MAX_MAX_RESULTS + ", got " + maxResults);
        }
    }
}
