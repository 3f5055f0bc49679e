package gmail.toolkit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Paginated search. Unlike {@link SearchRequest} there is no upper bound on maxResults.
 */
@Value
@Builder
public class BulkReadRequest {
    public static final int DEFAULT_MAX_RESULTS = 500;
    public static final int SLOW_FETCH_THRESHOLD = 2000;

    String query;

    @Builder.Default
    int maxResults = DEFAULT_MAX_RESULTS;

    @Builder.Default
    Format format = Format.METADATA;
}
