package axios.mail.sync.repository;

import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MailAccountRepository extends JpaRepository<MailAccount, String> {
    List<MailAccount> findByEnabledTrueAndSyncStatusNot(SyncStatus syncStatus);
    Optional<MailAccount> findByEmailAddress(String emailAddress);
}
