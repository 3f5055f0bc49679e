package gmail.toolkit.model;

import java.util.Locale;

public enum LabelAction {
    LIST,
    CREATE,
    APPLY,
    REMOVE;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
