package gmail.toolkit.service;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.springframework.stereotype.Component;

/**
 * Syntactic RFC 822 address check. Says nothing about whether the mailbox exists.
 */
@Component
public class AddressValidator {

    public boolean isValid(String address) {
        return parse(address) != null;
    }

    /**
     * @return the parsed address, or null if it is not a single valid address with a domain
     */
    public InternetAddress parse(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        try {
            InternetAddress parsed = new InternetAddress(address.trim(), true);
            parsed.validate();
            String addr = parsed.getAddress();
            if (addr == null || addr.indexOf('@') <= 0 || addr.endsWith("@")) {
                return null;
            }
            return parsed;
        } catch (AddressException e) {
            return null;
        }
    }
}
