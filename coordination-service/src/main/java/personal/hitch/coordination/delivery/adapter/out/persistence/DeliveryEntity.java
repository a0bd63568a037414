package personal.hitch.coordination.delivery.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.delivery.domain.model.DeliveryStatus;

import java.time.LocalDateTime;

/**
 * Delivery JPA Entity
 * 배송 요청 테이블 매핑 (행 생성은 외부 CRUD 시스템 담당)
 */
@Entity
@Table(name = "deliveries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sender_id", nullable = false)
    private Long senderId;

    @Column(name = "assigned_courier_id")
    private Long assignedCourierId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status;

    @Column(name = "accepted_at")
    private LocalDateTime acceptedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static DeliveryEntity fromDomain(Delivery delivery) {
        DeliveryEntity entity = new DeliveryEntity();
        entity.id = delivery.id();
        entity.senderId = delivery.senderId();
        entity.assignedCourierId = delivery.assignedCourierId();
        entity.status = delivery.status();
        entity.acceptedAt = delivery.acceptedAt();
        entity.createdAt = delivery.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Delivery toDomain() {
        return new Delivery(id, senderId, assignedCourierId, status, acceptedAt, createdAt);
    }
}
