package axios.mail.sync.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "push_subscriptions")
@Data
public class PushSubscription {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(length = 2000, unique = true)
    private String endpoint;

    @Column(length = 500)
    private String p256dh;

    @Column(length = 500)
    private String auth;

    private Instant createdAt;

    private Instant lastUsedAt;
}
