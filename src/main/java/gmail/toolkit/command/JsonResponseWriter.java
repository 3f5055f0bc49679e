package gmail.toolkit.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.exception.GmailCommandException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the JSON envelopes: {@code {"status":"success", ...payload}} or
 * {@code {"status":"error","error_type":...,"message":...}}. Both go to stdout.
 */
@Component
public class JsonResponseWriter {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public JsonResponseWriter(ObjectMapper objectMapper) {
        this(objectMapper, System.out);
    }

    public JsonResponseWriter(ObjectMapper objectMapper, PrintStream out) {
        this.objectMapper = objectMapper;
        this.out = out;
    }

    public void writeSuccess(Object payload) {
        print(successNode(payload));
    }

    public void writeSuccessToFile(Object payload, Path file) throws IOException {
        Files.writeString(file, render(successNode(payload)), StandardCharsets.UTF_8);
    }

    public void writeError(GmailCommandException e) {
        writeError(e.getErrorType(), e.getMessage());
    }

    public void writeError(ErrorType errorType, String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("status", STATUS_ERROR);
        node.put("error_type", errorType.getWireName());
        node.put("message", message);
        print(node);
    }

    /**
     * A {@code status} inside the payload overrides the default {@code success}.
     */
    ObjectNode successNode(Object payload) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("status", STATUS_SUCCESS);
        JsonNode body = objectMapper.valueToTree(payload);
        if (body instanceof ObjectNode) {
            node.setAll((ObjectNode) body);
        }
        return node;
    }

    private void print(JsonNode node) {
        out.println(render(node));
        out.flush();
    }

    private String render(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise response", e);
        }
    }
}
