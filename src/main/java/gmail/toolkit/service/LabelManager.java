package gmail.toolkit.service;

import com.google.api.services.gmail.model.Label;
import gmail.toolkit.exception.AuthenticationException;
import gmail.toolkit.exception.LabelException;
import gmail.toolkit.exception.ValidationException;
import gmail.toolkit.model.LabelAction;
import gmail.toolkit.model.LabelInfo;
import gmail.toolkit.model.LabelModificationResult;
import gmail.toolkit.model.MessageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lists, creates, applies and removes labels. Labels are addressed by name here and by id on the wire.
 */
@Slf4j
@Service
public class LabelManager {
    public static final Set<String> SYSTEM_LABELS = Set.of(
        "INBOX", "SENT", "DRAFT", "SPAM", "TRASH", "UNREAD", "STARRED", "IMPORTANT", "CHAT");
    public static final String CATEGORY_PREFIX = "CATEGORY_";

    private final GmailApiService gmailApiService;

    public LabelManager(GmailApiService gmailApiService) {
        this.gmailApiService = gmailApiService;
    }

    public static boolean isSystemLabel(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return SYSTEM_LABELS.contains(normalized) || normalized.startsWith(CATEGORY_PREFIX);
    }

    public List<LabelInfo> list(GmailSession session) {
        try {
            List<LabelInfo> labels = new ArrayList<>();
            for (Label label : gmailApiService.listLabels(session)) {
                labels.add(toInfo(label));
            }
            return labels;
        } catch (IOException e) {
            throw ProviderErrors.translate(e, LabelException::new);
        }
    }

    /**
     * @throws ValidationException if the name is blank or reserved by Gmail
     * @throws LabelException if a label with this name already exists
     */
    public LabelInfo create(GmailSession session, String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required to create a label");
        }
        if (isSystemLabel(name)) {
            throw new ValidationException("Cannot create label '" + name + "': it is a reserved system label");
        }
        try {
            Label created = gmailApiService.createLabel(session, name.trim());
            log.info("Created label '{}' ({})", created.getName(), created.getId());
            return toInfo(created);
        } catch (IOException e) {
            if (ProviderErrors.statusOf(e) == 409) {
                throw new LabelException("Label already exists: " + name.trim(), e);
            }
            throw ProviderErrors.translate(e, LabelException::new);
        }
    }

    public LabelModificationResult apply(GmailSession session, String labelName, List<String> messageIds) {
        return modify(session, LabelAction.APPLY, labelName, messageIds);
    }

    public LabelModificationResult remove(GmailSession session, String labelName, List<String> messageIds) {
        return modify(session, LabelAction.REMOVE, labelName, messageIds);
    }

    private LabelModificationResult modify(GmailSession session, LabelAction action, String labelName,
                                           List<String> messageIds) {
        if (labelName == null || labelName.isBlank()) {
            throw new ValidationException("label-name is required to " + action.getValue() + " a label");
        }
        if (messageIds == null || messageIds.isEmpty()) {
            throw new ValidationException("message-ids is required to " + action.getValue() + " a label");
        }

        String labelId = resolveLabelId(session, labelName.trim());
        List<String> labelIds = Collections.singletonList(labelId);
        List<MessageOutcome> results = new ArrayList<>();
        List<String> updated = new ArrayList<>();

        for (String messageId : messageIds) {
            try {
                if (action == LabelAction.APPLY) {
                    gmailApiService.modifyLabels(session, messageId, labelIds, Collections.emptyList());
                } else {
                    gmailApiService.modifyLabels(session, messageId, Collections.emptyList(), labelIds);
                }
                results.add(MessageOutcome.success(messageId));
                updated.add(messageId);
            } catch (IOException e) {
                if (ProviderErrors.isAuthenticationFailure(e)) {
                    log.error("Authorization rejected at message {}, {} of {} already updated", messageId,
                            updated.size(), messageIds.size());
                    throw new AuthenticationException(ProviderErrors.messageOf(e) + " (" + updated.size() + " of "
                        + messageIds.size() + " messages were already updated"
                        + (updated.isEmpty() ? "" : ": " + String.join(", ", updated)) + ")", e);
                }
                log.warn("Failed to {} label {} on message {}: {}", action.getValue(), labelId, messageId,
                        ProviderErrors.messageOf(e));
                results.add(MessageOutcome.failure(messageId, ProviderErrors.messageOf(e)));
            }
        }

        LabelModificationResult result = LabelModificationResult.of(action, labelName.trim(), labelId, results);
        log.info("{} label '{}': {} succeeded, {} failed", action.getValue(), labelName,
                result.getSucceeded(), result.getFailed());
        return result;
    }

    /**
     * Exact name match first, then case-insensitive.
     * @throws LabelException if no label has this name
     */
    String resolveLabelId(GmailSession session, String labelName) {
        List<Label> labels;
        try {
            labels = gmailApiService.listLabels(session);
        } catch (IOException e) {
            throw ProviderErrors.translate(e, LabelException::new);
        }
        for (Label label : labels) {
            if (labelName.equals(label.getName())) {
                return label.getId();
            }
        }
        for (Label label : labels) {
            if (labelName.equalsIgnoreCase(label.getName())) {
                return label.getId();
            }
        }
        throw new LabelException("Label not found: " + labelName);
    }

    private static LabelInfo toInfo(Label label) {
        return new LabelInfo(label.getId(), label.getName(), label.getType());
    }
}
