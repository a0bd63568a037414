package personal.hitch.coordination.notification.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hitch.coordination.notification.domain.model.NotificationType;

import java.time.LocalDateTime;

/**
 * Notification JPA Entity
 * data는 JSON 문자열로 저장
 */
@Entity
@Table(name = "notifications",
        indexes = {
                @Index(name = "idx_notification_user_created", columnList = "user_id, created_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private NotificationType type;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String body;

    @Column(length = 4000)
    private String data;

    @Column(nullable = false)
    private boolean delivered;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static NotificationEntity create(Long userId, NotificationType type, String title, String body,
                                            String data, boolean delivered, LocalDateTime createdAt) {
        NotificationEntity entity = new NotificationEntity();
        entity.userId = userId;
        entity.type = type;
        entity.title = title;
        entity.body = body;
        entity.data = data;
        entity.delivered = delivered;
        entity.createdAt = createdAt;
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
