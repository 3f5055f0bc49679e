package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Root command. Sub-commands are Spring beans created through the picocli Spring factory.
 */
@Slf4j
@Component
@Command(name = "gmail-toolkit", mixinStandardHelpOptions = true, version = "gmail-toolkit 0.0.1",
        description = "Search, send and label Gmail messages from the command line. Output is JSON.",
        subcommands = {
            ReadCommand.class,
            BulkReadCommand.class,
            SendCommand.class,
            LabelsCommand.class,
            MarkReadCommand.class,
            AuthCommand.class
        })
public class GmailCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Applies the shared parser settings. Command-line parse errors are reported as a ValidationError envelope.
     */
    public static CommandLine configure(CommandLine commandLine, JsonResponseWriter responseWriter) {
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setParameterExceptionHandler((ex, args) -> {
            log.debug("Invalid arguments: {}", ex.getMessage());
            responseWriter.writeError(ErrorType.VALIDATION_ERROR, ex.getMessage());
            return AbstractGmailCommand.EXIT_FAILURE;
        });
        return commandLine;
    }
}
