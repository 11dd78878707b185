package axios.mail.sync.repository;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MailMessageRepository extends JpaRepository<MailMessage, String> {
    Optional<MailMessage> findByAccountIdAndRemoteId(String accountId, String remoteId);
    Optional<MailMessage> findFirstByAccountIdAndInternetMessageId(String accountId, String internetMessageId);
    List<MailMessage> findByAccountIdAndFolder(String accountId, Folder folder);

    // retry backlog for the classification gate
    List<MailMessage> findByAccountIdAndClassifiedFalseAndManuallyTaggedFalseAndFolderNotOrderByIngestedAtAsc(
            String accountId, Folder excludedFolder, Pageable pageable);
}
