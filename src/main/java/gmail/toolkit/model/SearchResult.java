package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

@Value
@JsonPropertyOrder({"result_count", "query", "messages"})
public class SearchResult {
    @JsonProperty("result_count")
    int resultCount;
    String query;
    List<ProjectedMessage> messages;
}
