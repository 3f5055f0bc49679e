package gmail.toolkit.service;

import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import gmail.toolkit.model.PagedMessageIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects message ids across result pages until maxResults is reached or Gmail runs out of pages.
 */
@Slf4j
@Component
public class MessageIdPager {
    // Gmail returns at most 100 ids per page
    public static final int PAGE_SIZE = 100;

    private final GmailApiService gmailApiService;

    public MessageIdPager(GmailApiService gmailApiService) {
        this.gmailApiService = gmailApiService;
    }

    public PagedMessageIds collect(GmailSession session, String query, int maxResults) throws IOException {
        List<String> ids = new ArrayList<>();
        String pageToken = null;
        int pages = 0;

        while (ids.size() < maxResults) {
            pages++;
            int pageSize = Math.min(PAGE_SIZE, maxResults - ids.size());
            log.info("Fetching page {}... ({} messages so far)", pages, ids.size());

            ListMessagesResponse response = gmailApiService.listMessages(session, query, pageSize, pageToken);
            List<Message> messages = response.getMessages();
            if (messages == null || messages.isEmpty()) {
                break;
            }
            for (Message message : messages) {
                if (ids.size() >= maxResults) {
                    break;
                }
                ids.add(message.getId());
            }

            pageToken = response.getNextPageToken();
            if (pageToken == null || pageToken.isEmpty()) {
                break;
            }
        }

        log.info("Found {} messages total", ids.size());
        return new PagedMessageIds(ids, pages);
    }
}
