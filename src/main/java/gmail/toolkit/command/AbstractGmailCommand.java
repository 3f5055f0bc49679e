package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.exception.GmailCommandException;
import gmail.toolkit.service.GmailSessionFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Runs a sub-command and turns any failure into the JSON error envelope with a non-zero exit code.
 */
@Slf4j
public abstract class AbstractGmailCommand implements Callable<Integer> {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    protected final GmailSessionFactory sessionFactory;
    protected final JsonResponseWriter responseWriter;

    protected AbstractGmailCommand(GmailSessionFactory sessionFactory, JsonResponseWriter responseWriter) {
        this.sessionFactory = sessionFactory;
        this.responseWriter = responseWriter;
    }

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (GmailCommandException e) {
            log.debug("Command failed with {}: {}", e.getErrorType().getWireName(), e.getMessage(), e);
            responseWriter.writeError(e);
            return EXIT_FAILURE;
        } catch (IOException | RuntimeException e) {
            log.error("Unexpected error: {}", e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            responseWriter.writeError(defaultErrorType(), message);
            return EXIT_FAILURE;
        }
    }

    /**
     * @return the process exit code
     */
    protected abstract int execute() throws IOException;

    /**
     * Error type reported for failures that are not already a {@link GmailCommandException}.
     */
    protected abstract ErrorType defaultErrorType();
}
