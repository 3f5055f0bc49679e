package gmail.toolkit.service;

import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.BatchModifyMessagesRequest;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import gmail.toolkit.model.Format;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
public class GmailService implements GmailApiService {

    @Override
    public ListMessagesResponse listMessages(GmailSession session, String query, long maxResults, String pageToken)
            throws IOException {
        Gmail.Users.Messages.List request = session.client().users().messages().list(session.getUserId())
            .setQ(query)
            .setMaxResults(maxResults);
        if (pageToken != null && !pageToken.isEmpty()) {
            request.setPageToken(pageToken);
        }
        log.debug("Listing messages: q='{}', maxResults={}, pageToken={}", query, maxResults, pageToken);
        return request.execute();
    }

    @Override
    public Message getMessage(GmailSession session, String messageId, Format format) throws IOException {
        return session.client().users().messages().get(session.getUserId(), messageId)
            .setFormat(format.getApiFormat())
            .execute();
    }

    @Override
    public Message sendMessage(GmailSession session, String rawMessage) throws IOException {
        Message message = new Message().setRaw(rawMessage);
        return session.client().users().messages().send(session.getUserId(), message).execute();
    }

    @Override
    public List<Label> listLabels(GmailSession session) throws IOException {
        ListLabelsResponse response = session.client().users().labels().list(session.getUserId()).execute();
        return response.getLabels() != null ? response.getLabels() : Collections.emptyList();
    }

    @Override
    public Label createLabel(GmailSession session, String name) throws IOException {
        Label label = new Label()
            .setName(name)
            .setLabelListVisibility("labelShow")
            .setMessageListVisibility("show");
        return session.client().users().labels().create(session.getUserId(), label).execute();
    }

    @Override
    public Message modifyLabels(GmailSession session, String messageId, List<String> addLabelIds,
                                List<String> removeLabelIds) throws IOException {
        ModifyMessageRequest mods = new ModifyMessageRequest()
            .setAddLabelIds(addLabelIds)
            .setRemoveLabelIds(removeLabelIds);
        return session.client().users().messages().modify(session.getUserId(), messageId, mods).execute();
    }

    @Override
    public void batchModifyLabels(GmailSession session, List<String> messageIds, List<String> addLabelIds,
                                  List<String> removeLabelIds) throws IOException {
        BatchModifyMessagesRequest request = new BatchModifyMessagesRequest()
            .setIds(messageIds)
            .setAddLabelIds(addLabelIds)
            .setRemoveLabelIds(removeLabelIds);
        session.client().users().messages().batchModify(session.getUserId(), request).execute();
    }
}
