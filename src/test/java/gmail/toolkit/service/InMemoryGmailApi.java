package gmail.toolkit.service;

import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import gmail.toolkit.model.Format;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps labels and per-message label sets in memory, with Gmail's set semantics for modify.
 */
class InMemoryGmailApi implements GmailApiService {
    private final List<Label> labels = new ArrayList<>();
    private final Map<String, Set<String>> messageLabels = new LinkedHashMap<>();

    void addLabel(String id, String name) {
        labels.add(new Label().setId(id).setName(name).setType("user"));
    }

    void addMessage(String id, String... labelIds) {
        messageLabels.put(id, new LinkedHashSet<>(List.of(labelIds)));
    }

    List<String> labelsOf(String messageId) {
        return new ArrayList<>(messageLabels.get(messageId));
    }

    @Override
    public ListMessagesResponse listMessages(GmailSession session, String query, long maxResults, String pageToken) {
        List<Message> refs = new ArrayList<>();
        for (String id : messageLabels.keySet()) {
            if (refs.size() >= maxResults) {
                break;
            }
            refs.add(new Message().setId(id));
        }
        return new ListMessagesResponse().setMessages(refs);
    }

    @Override
    public Message getMessage(GmailSession session, String messageId, Format format) throws IOException {
        return new Message().setId(requireMessage(messageId)).setLabelIds(labelsOf(messageId));
    }

    @Override
    public Message sendMessage(GmailSession session, String rawMessage) {
        throw new UnsupportedOperationException("send");
    }

    @Override
    public List<Label> listLabels(GmailSession session) {
        return new ArrayList<>(labels);
    }

    @Override
    public Label createLabel(GmailSession session, String name) {
        Label label = new Label().setId("Label_" + (labels.size() + 1)).setName(name).setType("user");
        labels.add(label);
        return label;
    }

    @Override
    public Message modifyLabels(GmailSession session, String messageId, List<String> addLabelIds,
                                List<String> removeLabelIds) throws IOException {
        Set<String> current = messageLabels.get(requireMessage(messageId));
        current.addAll(addLabelIds);
        current.removeAll(removeLabelIds);
        return new Message().setId(messageId).setLabelIds(new ArrayList<>(current));
    }

    @Override
    public void batchModifyLabels(GmailSession session, List<String> messageIds, List<String> addLabelIds,
                                  List<String> removeLabelIds) throws IOException {
        for (String messageId : messageIds) {
            modifyLabels(session, messageId, addLabelIds, removeLabelIds);
        }
    }

    private String requireMessage(String messageId) throws IOException {
        if (!messageLabels.containsKey(messageId)) {
            throw GmailApiErrors.jsonError(404, "Requested entity was not found.");
        }
        return messageId;
    }
}
