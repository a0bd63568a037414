package personal.hitch.coordination.notification.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.notification.application.port.out.NotificationRepository;
import personal.hitch.coordination.notification.domain.model.Notification;

import java.util.List;
import java.util.Map;

/**
 * Notification Persistence Adapter
 * NotificationRepository 구현체 (data 필드는 Jackson으로 직렬화)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationPersistenceAdapter implements NotificationRepository {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final JpaNotificationRepository jpaNotificationRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Notification save(Notification notification) {
        NotificationEntity entity = NotificationEntity.create(
                notification.userId(),
                notification.type(),
                notification.title(),
                notification.body(),
                writeData(notification.data()),
                notification.delivered(),
                notification.createdAt());
        return toDomain(jpaNotificationRepository.saveAndFlush(entity));
    }

    @Override
    public boolean markDelivered(Long notificationId) {
        return jpaNotificationRepository.markDelivered(notificationId) == 1;
    }

    @Override
    public List<Notification> findRecentByUserId(Long userId, int limit) {
        return jpaNotificationRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(0, limit))
                .stream()
                .map(this::toDomain)
                .toList();
    }

    private Notification toDomain(NotificationEntity entity) {
        return new Notification(
                entity.getId(),
                entity.getUserId(),
                entity.getType(),
                entity.getTitle(),
                entity.getBody(),
                readData(entity.getData()),
                entity.isDelivered(),
                entity.getCreatedAt());
    }

    private String writeData(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize notification data", e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to serialize notification data", e);
        }
    }

    private Map<String, Object> readData(String data) {
        if (data == null || data.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(data, DATA_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize notification data", e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to deserialize notification data", e);
        }
    }
}
