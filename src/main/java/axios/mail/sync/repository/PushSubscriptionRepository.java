package axios.mail.sync.repository;

import axios.mail.sync.entity.PushSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PushSubscriptionRepository extends JpaRepository<PushSubscription, String> {
    Optional<PushSubscription> findByEndpoint(String endpoint);
}
