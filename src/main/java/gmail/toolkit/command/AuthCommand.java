package gmail.toolkit.command;

import gmail.toolkit.exception.ErrorType;
import gmail.toolkit.service.GmailSessionFactory;
import gmail.toolkit.service.OAuthTokenService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Map;

@Component
@Command(name = "auth", mixinStandardHelpOptions = true,
        description = "Run the one-time browser authorization and store the OAuth token.")
public class AuthCommand extends AbstractGmailCommand {
    private final OAuthTokenService oauthTokenService;

    public AuthCommand(GmailSessionFactory sessionFactory, JsonResponseWriter responseWriter,
                       OAuthTokenService oauthTokenService) {
        super(sessionFactory, responseWriter);
        this.oauthTokenService = oauthTokenService;
    }

    @Override
    protected int execute() {
        oauthTokenService.authorize();
        responseWriter.writeSuccess(Map.of("message",
                "Authorization complete, token stored in " + oauthTokenService.getTokensDir()));
        return EXIT_OK;
    }

    @Override
    protected ErrorType defaultErrorType() {
        return ErrorType.AUTHENTICATION_ERROR;
    }
}
