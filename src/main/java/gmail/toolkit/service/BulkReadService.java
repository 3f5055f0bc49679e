package gmail.toolkit.service;

import gmail.toolkit.exception.SearchException;
import gmail.toolkit.exception.ValidationException;
import gmail.toolkit.model.BulkReadRequest;
import gmail.toolkit.model.BulkReadResult;
import gmail.toolkit.model.Format;
import gmail.toolkit.model.PagedMessageIds;
import gmail.toolkit.model.ProjectedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Search without the 100-message ceiling: pages through the list endpoint, then fetches every message.
 */
@Slf4j
@Service
public class BulkReadService {
    private final MessageIdPager messageIdPager;
    private final QueryNormalizer queryNormalizer;

    public BulkReadService(MessageIdPager messageIdPager, QueryNormalizer queryNormalizer) {
        this.messageIdPager = messageIdPager;
        this.queryNormalizer = queryNormalizer;
    }

    public BulkReadResult bulkSearch(GmailSession session, BulkReadRequest request) {
        if (request.getQuery() == null) {
            throw new ValidationException("query is required");
        }
        if (request.getMaxResults() < 1) {
            throw new ValidationException("max-results must be at least 1, got " + request.getMaxResults());
        }
        if (request.getMaxResults() > BulkReadRequest.SLOW_FETCH_THRESHOLD) {
            log.warn("Fetching more than {} emails may be slow and hit rate limits",
                    BulkReadRequest.SLOW_FETCH_THRESHOLD);
        }
        Format format = request.getFormat() != null ? request.getFormat() : Format.METADATA;

        try {
            PagedMessageIds paged = messageIdPager.collect(session, request.getQuery(), request.getMaxResults());
            List<ProjectedMessage> messages = queryNormalizer.fetchProjected(session, paged.getIds(), format);
            log.info("Bulk read completed: {} messages", messages.size());
            return new BulkReadResult(messages.size(), request.getQuery(), messages,
                    new BulkReadResult.Metadata(paged.getPagesFetched(), format));
        } catch (IOException e) {
            log.warn("Bulk read for '{}' failed: {}", request.getQuery(), e.getMessage());
            throw ProviderErrors.translate(e, SearchException::new);
        }
    }
}
