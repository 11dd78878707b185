package axios.mail.sync.provider;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class FetchResult {
    private final List<RemoteMessage> messages;
    private final String newCursor;
}
