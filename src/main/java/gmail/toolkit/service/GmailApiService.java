package gmail.toolkit.service;

import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import gmail.toolkit.model.Format;

import java.io.IOException;
import java.util.List;

/**
 * Interface for Gmail API operations.
 * Every call takes the session explicitly; implementations hold no authentication state of their own.
 */
public interface GmailApiService {
    /**
     * List message references matching a Gmail search query.
     * @param session authenticated session
     * @param query raw Gmail search string, passed to the provider unmodified
     * @param maxResults page size
     * @param pageToken token of the page to fetch, or null for the first page
     * @return the page of message references (ids and thread ids only)
     * @throws IOException if the API call fails
     */
    ListMessagesResponse listMessages(GmailSession session, String query, long maxResults, String pageToken)
            throws IOException;

    /**
     * Get a single message in the provider format matching the requested projection.
     * @param session authenticated session
     * @param messageId Gmail message ID
     * @param format projection the message will be reduced to
     * @return Gmail Message object
     * @throws IOException if the API call fails
     */
    Message getMessage(GmailSession session, String messageId, Format format) throws IOException;

    /**
     * Send an RFC 822 message.
     * @param session authenticated session
     * @param rawMessage base64url-encoded message bytes
     * @return the sent message (id, thread id, labels)
     * @throws IOException if the API call fails
     */
    Message sendMessage(GmailSession session, String rawMessage) throws IOException;

    List<Label> listLabels(GmailSession session) throws IOException;

    Label createLabel(GmailSession session, String name) throws IOException;

    /**
     * Add and remove labels on one message. Adding a present label or removing an absent one is a no-op.
     * @throws IOException if the API call fails
     */
    Message modifyLabels(GmailSession session, String messageId, List<String> addLabelIds, List<String> removeLabelIds)
            throws IOException;

    /**
     * Add and remove labels on up to 1000 messages in a single call.
     * @throws IOException if the API call fails
     */
    void batchModifyLabels(GmailSession session, List<String> messageIds, List<String> addLabelIds,
                           List<String> removeLabelIds) throws IOException;
}
