package gmail.toolkit;

import gmail.toolkit.command.GmailCommand;
import gmail.toolkit.command.JsonResponseWriter;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

@SpringBootApplication
public class GmailToolkitApplication implements CommandLineRunner, ExitCodeGenerator {
    private final GmailCommand gmailCommand;
    private final IFactory factory;
    private final JsonResponseWriter responseWriter;
    private int exitCode;

    public GmailToolkitApplication(GmailCommand gmailCommand, IFactory factory, JsonResponseWriter responseWriter) {
        this.gmailCommand = gmailCommand;
        this.factory = factory;
        this.responseWriter = responseWriter;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GmailToolkitApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        exitCode = GmailCommand.configure(new CommandLine(gmailCommand, factory), responseWriter).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
