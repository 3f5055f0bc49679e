package gmail.toolkit.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single search invocation. The query is opaque: Gmail is the only interpreter of its grammar.
 */
@Value
@Builder
public class SearchRequest {
    public static final int DEFAULT_MAX_RESULTS = 10;
    public static final int MIN_MAX_RESULTS = 1;
    public static final int MAX_MAX_RESULTS = 100;

    String query;

    @Builder.Default
    Integer maxResults = DEFAULT_MAX_RESULTS;

    @Builder.Default
    Format format = Format.METADATA;
}
