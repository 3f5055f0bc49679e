package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

@Value
@JsonPropertyOrder({"id", "name", "type"})
public class LabelInfo {
    String id;
    String name;
    String type;
}
