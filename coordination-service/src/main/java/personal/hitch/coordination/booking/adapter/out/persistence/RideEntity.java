package personal.hitch.coordination.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.booking.domain.model.RideStatus;

import java.time.LocalDateTime;

/**
 * Ride JPA Entity
 * 운행 테이블 매핑 (행 생성은 외부 CRUD 시스템 담당)
 */
@Entity
@Table(name = "rides")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RideEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    @Column(name = "total_seats", nullable = false)
    private int totalSeats;

    @Column(name = "committed_seats", nullable = false)
    private int committedSeats;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RideStatus status;

    @Column(name = "departure_time", nullable = false)
    private LocalDateTime departureTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static RideEntity fromDomain(Ride ride) {
        RideEntity entity = new RideEntity();
        entity.id = ride.id();
        entity.driverId = ride.driverId();
        entity.totalSeats = ride.totalSeats();
        entity.committedSeats = ride.committedSeats();
        entity.status = ride.status();
        entity.departureTime = ride.departureTime();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Ride toDomain() {
        return new Ride(id, driverId, totalSeats, committedSeats, status, departureTime);
    }
}
