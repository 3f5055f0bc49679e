package gmail.toolkit.service;

import gmail.toolkit.exception.MarkReadException;
import gmail.toolkit.exception.SearchException;
import gmail.toolkit.exception.ValidationException;
import gmail.toolkit.model.MarkReadRequest;
import gmail.toolkit.model.MarkReadResult;
import gmail.toolkit.model.PagedMessageIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Marks every message matching a query as read by removing UNREAD in batches.
 */
@Slf4j
@Service
public class MarkReadService {
    static final String UNREAD = "UNREAD";

    private final GmailApiService gmailApiService;
    private final MessageIdPager messageIdPager;

    public MarkReadService(GmailApiService gmailApiService, MessageIdPager messageIdPager) {
        this.gmailApiService = gmailApiService;
        this.messageIdPager = messageIdPager;
    }

    public MarkReadResult markAsRead(GmailSession session, MarkReadRequest request) {
        validate(request);

        List<String> ids;
        try {
            PagedMessageIds paged = messageIdPager.collect(session, request.getQuery(), request.getMaxResults());
            ids = paged.getIds();
        } catch (IOException e) {
            throw ProviderErrors.translate(e, SearchException::new);
        }
        if (ids.isEmpty()) {
            return MarkReadResult.nothingFound(request.getQuery());
        }

        int processed = 0;
        List<String> removeUnread = Collections.singletonList(UNREAD);
        for (int i = 0; i < ids.size(); i += request.getBatchSize()) {
            List<String> batch = ids.subList(i, Math.min(i + request.getBatchSize(), ids.size()));
            try {
                gmailApiService.batchModifyLabels(session, batch, Collections.emptyList(), removeUnread);
            } catch (IOException e) {
                int done = processed;
                int total = ids.size();
                log.error("Batch {} failed after {} messages were marked read: {}",
                        i / request.getBatchSize() + 1, done, e.getMessage());
                throw ProviderErrors.translate(e, (message, cause) -> new MarkReadException(
                    message + " (" + done + " of " + total + " messages were already marked read)", cause));
            }
            processed += batch.size();
            log.info("Marked {}/{} messages as read", processed, ids.size());
        }
        return MarkReadResult.of(request.getQuery(), processed);
    }

    static void validate(MarkReadRequest request) {
        if (request.getQuery() == null) {
            throw new ValidationException("query is required");
        }
        if (request.getMaxResults() < 1) {
            throw new ValidationException("max-results must be at least 1, got " + request.getMaxResults());
        }
        if (request.getBatchSize() < 1 || request.getBatchSize() > MarkReadRequest.MAX_BATCH_SIZE) {
            throw new ValidationException("batch-size must be between 1 and " + MarkReadRequest.MAX_BATCH_SIZE
                + ", got " + request.getBatchSize());
        }
    }
}
