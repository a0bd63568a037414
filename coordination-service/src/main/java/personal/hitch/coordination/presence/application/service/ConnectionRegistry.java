package personal.hitch.coordination.presence.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.presence.application.port.out.ClientConnection;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection Registry
 * 살아있는 연결 테이블 (connectionId -> 연결 핸들, 인증된 사용자)
 *
 * Presence와 Room은 연결을 ID로만 참조하므로 정리는 이 맵에서의 삭제로 끝난다.
 * 개별 연결 쓰기 실패는 해당 연결에만 격리되고, 실패한 연결은 닫힌다.
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, ConnectionSlot> connections = new ConcurrentHashMap<>();
    private final Counter deliveryCounter;
    private final Counter failureCounter;

    public ConnectionRegistry(MeterRegistry meterRegistry) {
        this.deliveryCounter = Counter.builder("realtime.broadcast.deliveries")
                .description("Events written to client connections")
                .register(meterRegistry);
        this.failureCounter = Counter.builder("realtime.broadcast.failures")
                .description("Failed writes to client connections")
                .register(meterRegistry);
        Gauge.builder("realtime.connections", connections, ConcurrentHashMap::size)
                .description("Live client connections")
                .register(meterRegistry);
    }

    public void register(ClientConnection connection) {
        ConnectionSlot existing = connections.putIfAbsent(connection.id(), new ConnectionSlot(connection));
        if (existing != null) {
            throw new IllegalStateException("Connection already registered: connectionId=" + connection.id());
        }
        log.debug("Connection registered: connectionId={}", connection.id());
    }

    /**
     * 연결 제거
     *
     * @return 제거된 연결 (이미 없으면 empty)
     */
    public Optional<ClientConnection> unregister(String connectionId) {
        ConnectionSlot removed = connections.remove(connectionId);
        return Optional.ofNullable(removed).map(ConnectionSlot::connection);
    }

    /**
     * 정리 시작 표시
     * 이후 이 연결로의 전송과 Room 가입은 거부된다.
     */
    public void markClosing(String connectionId) {
        ConnectionSlot slot = connections.get(connectionId);
        if (slot != null) {
            slot.closing = true;
        }
    }

    public boolean isActive(String connectionId) {
        ConnectionSlot slot = connections.get(connectionId);
        return slot != null && !slot.closing;
    }

    /**
     * 연결에 인증된 사용자 연결
     *
     * @return 연결이 살아있어 바인딩되었으면 true
     */
    public boolean bindUser(String connectionId, Long userId) {
        ConnectionSlot slot = connections.get(connectionId);
        if (slot == null || slot.closing) {
            return false;
        }
        slot.userId = userId;
        return true;
    }

    public Optional<Long> userOf(String connectionId) {
        ConnectionSlot slot = connections.get(connectionId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.userId);
    }

    /**
     * 단일 연결로 이벤트 전송
     * 실패는 로그와 메트릭으로 남기고 해당 연결을 닫는다 (끊김 처리로 정리가 이어진다).
     *
     * @return 전송 성공 여부
     */
    public boolean send(String connectionId, RealtimeEvent event) {
        ConnectionSlot slot = connections.get(connectionId);
        if (slot == null || slot.closing) {
            return false;
        }

        ClientConnection connection = slot.connection();
        try {
            connection.send(event);
            deliveryCounter.increment();
            return true;
        } catch (IOException | RuntimeException e) {
            failureCounter.increment();
            log.warn("Failed to deliver event: connectionId={}, type={}, error={}",
                    connectionId, event.type(), e.getMessage());
            connection.close("delivery failure");
            return false;
        }
    }

    public void close(String connectionId, String reason) {
        ConnectionSlot slot = connections.get(connectionId);
        if (slot != null) {
            slot.connection().close(reason);
        }
    }

    public List<String> connectionIds() {
        return List.copyOf(connections.keySet());
    }

    public int size() {
        return connections.size();
    }

    private static final class ConnectionSlot {
        private final ClientConnection connection;
        private volatile Long userId;
        private volatile boolean closing;

        private ConnectionSlot(ClientConnection connection) {
            this.connection = connection;
        }

        private ClientConnection connection() {
            return connection;
        }
    }
}
