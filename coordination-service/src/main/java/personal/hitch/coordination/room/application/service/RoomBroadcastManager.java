package personal.hitch.coordination.room.application.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.hitch.coordination.presence.application.service.ConnectionRegistry;
import personal.hitch.coordination.room.application.port.in.BroadcastUseCase;
import personal.hitch.coordination.room.application.port.out.RoomLifecycleListener;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room Broadcast Manager
 * Room 멤버십 관리와 Room 단위 이벤트 fan-out
 *
 * - 멤버십 변경은 ConcurrentHashMap.compute로 Room 단위 원자성 보장
 * - 마지막 멤버가 나가면 Room을 즉시 삭제 (빈 Room 없음)
 * - 전송은 호출 스레드에서 순차 수행하므로 같은 발신자의 이벤트 순서가 보존된다
 * - 개별 연결 실패는 ConnectionRegistry에서 격리된다
 */
@Slf4j
@Service
public class RoomBroadcastManager implements BroadcastUseCase {

    public static final String PEER_JOINED = "peer_joined";
    public static final String PEER_LEFT = "peer_left";

    private final ConcurrentHashMap<RoomId, Set<String>> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<RoomId>> memberships = new ConcurrentHashMap<>();
    private final ConnectionRegistry connectionRegistry;
    private final List<RoomLifecycleListener> lifecycleListeners;

    public RoomBroadcastManager(ConnectionRegistry connectionRegistry,
                                List<RoomLifecycleListener> lifecycleListeners,
                                MeterRegistry meterRegistry) {
        this.connectionRegistry = connectionRegistry;
        this.lifecycleListeners = List.copyOf(lifecycleListeners);
        Gauge.builder("realtime.rooms", rooms, ConcurrentHashMap::size)
                .description("Rooms with at least one member")
                .register(meterRegistry);
    }

    /**
     * Room 가입 (멱등)
     * 새로 가입한 경우 기존 멤버에게 peer_joined 전송
     *
     * @return 새로 가입했으면 true
     */
    public boolean join(String connectionId, RoomId roomId) {
        if (!connectionRegistry.isActive(connectionId)) {
            log.debug("Join ignored for inactive connection: connectionId={}, room={}", connectionId, roomId);
            return false;
        }

        boolean[] added = {false};
        rooms.compute(roomId, (id, members) -> {
            Set<String> target = members == null ? ConcurrentHashMap.newKeySet() : members;
            added[0] = target.add(connectionId);
            return target;
        });
        memberships.computeIfAbsent(connectionId, id -> ConcurrentHashMap.newKeySet()).add(roomId);

        // 가입 도중 연결 정리가 시작되었으면 되돌린다
        if (!connectionRegistry.isActive(connectionId)) {
            leave(connectionId, roomId);
            return false;
        }

        if (added[0]) {
            log.debug("Room joined: connectionId={}, room={}", connectionId, roomId);
            broadcastExcept(roomId, peerEvent(PEER_JOINED, connectionId, roomId), connectionId);
        }
        return added[0];
    }

    /**
     * Room 탈퇴 (멱등)
     * 마지막 멤버였다면 Room 삭제, 남은 멤버에게 peer_left 전송
     *
     * @return 실제로 탈퇴했으면 true
     */
    public boolean leave(String connectionId, RoomId roomId) {
        boolean[] removed = {false};
        boolean[] destroyed = {false};
        rooms.computeIfPresent(roomId, (id, members) -> {
            removed[0] = members.remove(connectionId);
            if (members.isEmpty()) {
                destroyed[0] = true;
                return null;
            }
            return members;
        });
        memberships.computeIfPresent(connectionId, (id, joined) -> {
            joined.remove(roomId);
            return joined.isEmpty() ? null : joined;
        });

        if (destroyed[0]) {
            log.debug("Room destroyed: room={}", roomId);
            lifecycleListeners.forEach(listener -> listener.onRoomDestroyed(roomId));
        } else if (removed[0]) {
            broadcast(roomId, peerEvent(PEER_LEFT, connectionId, roomId));
        }
        return removed[0];
    }

    /**
     * 연결이 속한 모든 Room에서 탈퇴
     */
    public void leaveAll(String connectionId) {
        Set<RoomId> joined = memberships.get(connectionId);
        if (joined == null) {
            return;
        }
        for (RoomId roomId : Set.copyOf(joined)) {
            leave(connectionId, roomId);
        }
        memberships.remove(connectionId);
    }

    @Override
    public int broadcast(RoomId roomId, RealtimeEvent event) {
        return broadcastExcept(roomId, event, null);
    }

    /**
     * 특정 연결을 제외하고 브로드캐스트
     */
    public int broadcastExcept(RoomId roomId, RealtimeEvent event, String excludedConnectionId) {
        Set<String> members = rooms.get(roomId);
        if (members == null) {
            return 0;
        }

        int delivered = 0;
        for (String connectionId : members) {
            if (connectionId.equals(excludedConnectionId)) {
                continue;
            }
            if (connectionRegistry.send(connectionId, event)) {
                delivered++;
            }
        }
        log.debug("Broadcast completed: room={}, type={}, delivered={}", roomId, event.type(), delivered);
        return delivered;
    }

    public boolean sendTo(String connectionId, RealtimeEvent event) {
        return connectionRegistry.send(connectionId, event);
    }

    public Set<String> members(RoomId roomId) {
        Set<String> members = rooms.get(roomId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public Set<Long> memberUserIds(RoomId roomId) {
        Set<Long> userIds = new HashSet<>();
        for (String connectionId : members(roomId)) {
            connectionRegistry.userOf(connectionId).ifPresent(userIds::add);
        }
        return userIds;
    }

    public Set<RoomId> roomsOf(String connectionId) {
        Set<RoomId> joined = memberships.get(connectionId);
        return joined == null ? Set.of() : Set.copyOf(joined);
    }

    public boolean exists(RoomId roomId) {
        return rooms.containsKey(roomId);
    }

    public int roomCount() {
        return rooms.size();
    }

    /**
     * 전체 초기화 (서버 종료 시)
     */
    public void clear() {
        Set<RoomId> destroyed = Set.copyOf(rooms.keySet());
        rooms.clear();
        memberships.clear();
        destroyed.forEach(roomId -> lifecycleListeners.forEach(listener -> listener.onRoomDestroyed(roomId)));
    }

    private RealtimeEvent peerEvent(String type, String connectionId, RoomId roomId) {
        Optional<Long> userId = connectionRegistry.userOf(connectionId);
        return RealtimeEvent.of(type, Map.of(
                "room", roomId.toString(),
                "userId", userId.map(Object.class::cast).orElse("anonymous")));
    }
}
