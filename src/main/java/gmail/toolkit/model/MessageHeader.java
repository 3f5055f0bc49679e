package gmail.toolkit.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class MessageHeader {
    String name;
    String value;
}
