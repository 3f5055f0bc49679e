package gmail.toolkit.service;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.auth.oauth2.CredentialRefreshListener;
import com.google.api.client.extensions.java6.auth.oauth2.AuthorizationCodeInstalledApp;
import com.google.api.client.extensions.jetty.auth.oauth2.LocalServerReceiver;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.util.Clock;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.gmail.GmailScopes;
import gmail.toolkit.exception.AuthenticationException;
import gmail.toolkit.exception.MissingCredentialsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads OAuth client secrets and the persisted token, and runs the one-time browser authorization.
 * The token lives in a {@link FileDataStoreFactory} directory that replaces its file on every refresh.
 */
@Slf4j
@Service
public class OAuthTokenService {
    // gmail.modify covers reading, sending and label changes
    public static final List<String> SCOPES = List.of(GmailScopes.GMAIL_MODIFY);
    private static final String CREDENTIAL_USER_ID = "user";

    private final NetHttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final Clock clock;
    private final CredentialRefreshListener refreshListener;
    private final Path credentialsFile;
    private final Path tokensDir;
    private final int receiverPort;

    public OAuthTokenService(
            NetHttpTransport httpTransport,
            JsonFactory jsonFactory,
            Clock clock,
            CredentialRefreshListener refreshListener,
            @Value("${gmail.credentials-file}") Path credentialsFile,
            @Value("${gmail.tokens-dir}") Path tokensDir,
            @Value("${gmail.oauth.receiver-port:0}") int receiverPort) {
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.clock = clock;
        this.refreshListener = refreshListener;
        this.credentialsFile = credentialsFile;
        this.tokensDir = tokensDir;
        this.receiverPort = receiverPort;
    }

    /**
     * Loads the stored credential without any user interaction.
     * @throws MissingCredentialsException if the client secrets or the stored token are absent
     */
    public Credential loadCredential() {
        try {
            Credential credential = buildFlow().loadCredential(CREDENTIAL_USER_ID);
            if (credential == null) {
                throw new MissingCredentialsException(
                    "No stored OAuth token found in " + tokensDir + ". Run the auth command first.");
            }
            return credential;
        } catch (IOException e) {
            throw new MissingCredentialsException("Could not read stored OAuth token: " + e.getMessage(), e);
        }
    }

    /**
     * Runs the installed-application flow: opens the consent page and waits on a loopback receiver.
     */
    public Credential authorize() {
        GoogleAuthorizationCodeFlow flow;
        try {
            flow = buildFlow();
        } catch (IOException e) {
            throw new MissingCredentialsException("Could not initialise OAuth flow: " + e.getMessage(), e);
        }
        LocalServerReceiver receiver = new LocalServerReceiver.Builder()
            .setPort(receiverPort)
            .build();
        try {
            Credential credential = new AuthorizationCodeInstalledApp(flow, receiver).authorize(CREDENTIAL_USER_ID);
            log.info("Authorization successful, token stored in {}", tokensDir);
            return credential;
        } catch (IOException e) {
            throw new AuthenticationException("Authorization failed: " + e.getMessage(), e);
        }
    }

    public Path getTokensDir() {
        return tokensDir;
    }

    GoogleAuthorizationCodeFlow buildFlow() throws IOException {
        if (!Files.isRegularFile(credentialsFile)) {
            throw new MissingCredentialsException("OAuth client secrets not found at " + credentialsFile
                + ". Download credentials.json for a desktop client from the Google Cloud Console.");
        }
        GoogleClientSecrets clientSecrets;
        try (Reader reader = Files.newBufferedReader(credentialsFile, StandardCharsets.UTF_8)) {
            clientSecrets = GoogleClientSecrets.load(jsonFactory, reader);
        }
        return new GoogleAuthorizationCodeFlow.Builder(httpTransport, jsonFactory, clientSecrets, SCOPES)
            .setDataStoreFactory(new FileDataStoreFactory(tokensDir.toFile()))
            .setAccessType("offline")
            .setClock(clock)
            .addRefreshListener(refreshListener)
            .build();
    }
}
