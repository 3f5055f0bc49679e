package gmail.toolkit.service;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.exception.MarkReadException;
import gmail.toolkit.exception.ValidationException;
import gmail.toolkit.model.MarkReadRequest;
import gmail.toolkit.model.MarkReadResult;
import gmail.toolkit.model.PagedMessageIds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarkReadServiceTest {

    @Mock
    private GmailApiService gmailApiService;

    @Mock
    private MessageIdPager messageIdPager;

    @Mock
    private GmailSession session;

    @InjectMocks
    private MarkReadService markReadService;

    @Captor
    private ArgumentCaptor<List<String>> idsCaptor;

    @Test
    void markAsRead_ShouldRemoveUnreadInBatches() throws IOException {
        // Given
        List<String> ids = ids(250);
        when(messageIdPager.collect(session, "is:unread older_than:7d", 500))
            .thenReturn(new PagedMessageIds(ids, 3));

        // When
        MarkReadResult result = markReadService.markAsRead(session,
                MarkReadRequest.builder().query("is:unread older_than:7d").build());

        // Then
        assertEquals(250, result.getAffectedMessages());
        assertEquals(MarkReadResult.ACTION, result.getAction());
        assertNull(result.getMessage());
        verify(gmailApiService, times(3))
            .batchModifyLabels(eq(session), idsCaptor.capture(), eq(List.of()), eq(List.of("UNREAD")));
        List<Integer> sizes = new ArrayList<>();
        for (List<String> batch : idsCaptor.getAllValues()) {
            sizes.add(batch.size());
        }
        assertEquals(List.of(100, 100, 50), sizes);
    }

    @Test
    void markAsRead_WithNoMatches_ShouldReportNothingFound() throws IOException {
        // Given
        when(messageIdPager.collect(session, "is:unread", 500)).thenReturn(new PagedMessageIds(List.of(), 1));

        // When
        MarkReadResult result = markReadService.markAsRead(session,
                MarkReadRequest.builder().query("is:unread").build());

        // Then
        assertEquals(0, result.getAffectedMessages());
        assertEquals("No messages found matching query", result.getMessage());
        verifyNoInteractions(gmailApiService);
    }

    @Test
    void markAsRead_WithFailingSecondBatch_ShouldReportProgress() throws IOException {
        // Given
        when(messageIdPager.collect(session, "is:unread", 500)).thenReturn(new PagedMessageIds(ids(150), 2));
        doNothing()
            .doThrow(GmailApiErrors.jsonError(500, "Backend Error"))
            .when(gmailApiService).batchModifyLabels(eq(session), anyList(), anyList(), anyList());

        // When
        MarkReadException exception = assertThrows(MarkReadException.class, () -> markReadService.markAsRead(
                session, MarkReadRequest.builder().query("is:unread").build()));

        // Then
        assertEquals(ErrorType.MARK_READ_ERROR, exception.getErrorType());
        assertTrue(exception.getMessage().startsWith("Backend Error"));
        assertTrue(exception.getMessage().contains("100 of 150"));
    }

    @Test
    void markAsRead_WithOversizedBatch_ShouldRejectBeforeAnyRemoteCall() {
        // When / Then
        assertThrows(ValidationException.class, () -> markReadService.markAsRead(session,
                MarkReadRequest.builder().query("is:unread").batchSize(1001).build()));
        assertThrows(ValidationException.class, () -> markReadService.markAsRead(session,
                MarkReadRequest.builder().query("is:unread").batchSize(0).build()));
        verifyNoInteractions(gmailApiService, messageIdPager);
    }

    private static List<String> ids(int count) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add("msg-" + i);
        }
        return ids;
    }
}
