package axios.mail.sync.notify;

import lombok.Builder;
import lombok.Value;

/**
 * Notification shown by the service worker.
 */
@Value
@Builder
public class PushPayload {
    String title;
    String body;
    String url;
    String tag;
}
