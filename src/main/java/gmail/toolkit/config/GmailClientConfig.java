package gmail.toolkit.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.Clock;
import com.google.api.client.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.security.GeneralSecurityException;

/**
 * Transport, JSON and timing collaborators of the Google API client.
 * Clock and Sleeper are beans so token expiry and retry delays can be replaced in tests.
 */
@Configuration
public class GmailClientConfig {

    @Bean
    public NetHttpTransport gmailHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    @Bean
    public JsonFactory gmailJsonFactory() {
        return GsonFactory.getDefaultInstance();
    }

    @Bean
    public Clock gmailClock() {
        return Clock.SYSTEM;
    }

    @Bean
    public Sleeper gmailSleeper() {
        return Sleeper.DEFAULT;
    }
}
