package gmail.toolkit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import gmail.toolkit.exception.ErrorType;
import lombok.Value;

import java.util.List;

/**
 * Outcome of applying or removing a label across several messages.
 * {@code status} is {@code success} when every message succeeded, {@code partial} when only some did,
 * and {@code error} when none did. An {@code error} result also carries {@code error_type} and {@code message},
 * like every other error envelope.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "error_type", "message", "action", "label_name", "label_id", "succeeded", "failed",
    "results"})
public class LabelModificationResult {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_PARTIAL = "partial";
    public static final String STATUS_ERROR = "error";

    String status;
    @JsonProperty("error_type")
    String errorType;
    String message;
    String action;
    @JsonProperty("label_name")
    String labelName;
    @JsonProperty("label_id")
    String labelId;
    int succeeded;
    int failed;
    List<MessageOutcome> results;

    public static LabelModificationResult of(LabelAction action, String labelName, String labelId,
                                             List<MessageOutcome> results) {
        int succeeded = (int) results.stream().filter(MessageOutcome::isSuccess).count();
        int failed = results.size() - succeeded;
        if (failed > 0 && succeeded == 0) {
            String message = "Failed to " + action.getValue() + " label '" + labelName + "' on all "
                + failed + " message(s)";
            return new LabelModificationResult(STATUS_ERROR, ErrorType.LABEL_ERROR.getWireName(), message,
                    action.getValue(), labelName, labelId, succeeded, failed, results);
        }
        String status = failed == 0 ? STATUS_SUCCESS : STATUS_PARTIAL;
        return new LabelModificationResult(status, null, null, action.getValue(), labelName, labelId,
                succeeded, failed, results);
    }

    @JsonIgnore
    public boolean isComplete() {
        return failed == 0;
    }
}
