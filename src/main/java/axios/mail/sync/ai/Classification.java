package axios.mail.sync.ai;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class Classification {
    Set<String> tags;
    String priority;
    boolean actionRequired;
    boolean canArchive;
    double confidence;
}
