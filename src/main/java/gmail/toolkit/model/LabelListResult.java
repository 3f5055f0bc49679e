package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

@Value
@JsonPropertyOrder({"result_count", "labels"})
public class LabelListResult {
    @JsonProperty("result_count")
    int resultCount;
    List<LabelInfo> labels;

    public static LabelListResult of(List<LabelInfo> labels) {
        return new LabelListResult(labels.size(), labels);
    }
}
