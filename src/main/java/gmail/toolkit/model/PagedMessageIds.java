package gmail.toolkit.model;

import lombok.Value;

import java.util.List;

@Value
public class PagedMessageIds {
    List<String> ids;
    int pagesFetched;
}
