package axios.mail.sync.service;

import axios.mail.sync.entity.MailMessage;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public class MergeResult {
    private final List<MailMessage> ingested = new ArrayList<>();
    private int updated;
    // updates withheld because the message has a pending local operation
    private int protectedByPending;
    private int failures;

    void addIngested(MailMessage message) {
        ingested.add(message);
    }

    void incrementUpdated() {
        updated++;
    }

    void incrementProtected() {
        protectedByPending++;
    }

    void incrementFailures() {
        failures++;
    }
}
