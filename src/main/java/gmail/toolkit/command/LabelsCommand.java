package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.model.LabelAction;
import gmail.toolkit.model.LabelCreateResult;
import gmail.toolkit.model.LabelListResult;
import gmail.toolkit.model.LabelModificationResult;
import gmail.toolkit.service.GmailSession;
import gmail.toolkit.service.GmailSessionFactory;
import gmail.toolkit.service.LabelManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;

@Component
@Command(name = "labels", mixinStandardHelpOptions = true,
        description = "List, create, apply or remove Gmail labels.")
public class LabelsCommand extends AbstractGmailCommand {
    private final LabelManager labelManager;

    @Option(names = "--action", required = true, description = "list, create, apply or remove.")
    LabelAction action;

    @Option(names = "--name", description = "Name of the label to create.")
    String name;

    @Option(names = "--label-name", description = "Label to apply or remove.")
    String labelName;

    @Option(names = "--message-ids", split = ",", description = "Comma-separated message ids to apply to or remove from.")
    List<String> messageIds = new ArrayList<>();

    public LabelsCommand(GmailSessionFactory sessionFactory, JsonResponseWriter responseWriter,
                         LabelManager labelManager) {
        super(sessionFactory, responseWriter);
        this.labelManager = labelManager;
    }

    @Override
    protected int execute() {
        GmailSession session = sessionFactory.openSession();
        switch (action) {
            case LIST:
                responseWriter.writeSuccess(LabelListResult.of(labelManager.list(session)));
                return EXIT_OK;
            case CREATE:
                responseWriter.writeSuccess(LabelCreateResult.of(labelManager.create(session, name)));
                return EXIT_OK;
            case APPLY:
                return report(labelManager.apply(session, labelName, CsvValues.clean(messageIds)));
            case REMOVE:
                return report(labelManager.remove(session, labelName, CsvValues.clean(messageIds)));
            default:
                throw new IllegalStateException("Unhandled action: " + action);
        }
    }

    private int report(LabelModificationResult result) {
        responseWriter.writeSuccess(result);
        return result.isComplete() ? EXIT_OK : EXIT_FAILURE;
    }

    @Override
    protected ErrorType defaultErrorType() {
        return ErrorType.LABEL_ERROR;
    }
}
