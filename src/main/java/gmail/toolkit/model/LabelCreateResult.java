package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

@Value
@JsonPropertyOrder({"action", "label"})
public class LabelCreateResult {
    String action;
    LabelInfo label;

    public static LabelCreateResult of(LabelInfo label) {
        return new LabelCreateResult(LabelAction.CREATE.getValue(), label);
    }
}
