package gmail.toolkit.command;

import java.util.ArrayList;
import java.util.List;

final class CsvValues {

    private CsvValues() {
    }

    /**
     * Trims values split from a comma-separated option and drops empty ones.
     */
    static List<String> clean(List<String> values) {
        List<String> cleaned = new ArrayList<>();
        if (values == null) {
            return cleaned;
        }
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                cleaned.add(value.trim());
            }
        }
        return cleaned;
    }
}
