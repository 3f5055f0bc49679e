package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

@Value
@JsonPropertyOrder({"result_count", "query", "messages", "metadata"})
public class BulkReadResult {
    @JsonProperty("result_count")
    int resultCount;
    String query;
    List<ProjectedMessage> messages;
    Metadata metadata;

    @Value
    @JsonPropertyOrder({"pages_fetched", "format"})
    public static class Metadata {
        @JsonProperty("pages_fetched")
        int pagesFetched;
        Format format;
    }
}
