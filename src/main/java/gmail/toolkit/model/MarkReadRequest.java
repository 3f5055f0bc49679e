package gmail.toolkit.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarkReadRequest {
    public static final int DEFAULT_MAX_RESULTS = 500;
    public static final int DEFAULT_BATCH_SIZE = 100;
    // batchModify accepts at most 1000 ids per call
    public static final int MAX_BATCH_SIZE = 1000;

    String query;

    @Builder.Default
    int maxResults = DEFAULT_MAX_RESULTS;

    @Builder.Default
    int batchSize = DEFAULT_BATCH_SIZE;
}
