package axios.mail.sync.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ClearTrashResult {
    private final int deleted;
    private final int queued;
}
