package personal.hitch.coordination.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

/**
 * Booking JPA Entity
 * 예약 테이블 매핑
 * active_booking_key Unique Index가 (운행, 승객)당 활성 예약 하나를 보장하는 2차 방어선
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_active_booking",
                columnNames = {"active_booking_key"}
        ),
        indexes = {
                @Index(name = "idx_ride_passenger", columnList = "ride_id, passenger_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ride_id", nullable = false)
    private Long rideId;

    @Column(name = "passenger_id", nullable = false)
    private Long passengerId;

    @Column(nullable = false)
    private int seats;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    // 활성 예약이면 "rideId:passengerId", 아니면 null
    @Column(name = "active_booking_key", length = 64)
    private String activeBookingKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.rideId = booking.rideId();
        entity.passengerId = booking.passengerId();
        entity.seats = booking.seats();
        entity.status = booking.status();
        entity.activeBookingKey = booking.activeBookingKey();
        entity.createdAt = booking.createdAt();
        entity.updatedAt = booking.updatedAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Booking toDomain() {
        return new Booking(id, rideId, passengerId, seats, status, createdAt, updatedAt);
    }
}
