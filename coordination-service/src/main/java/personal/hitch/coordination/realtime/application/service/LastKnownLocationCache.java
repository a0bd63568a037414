package personal.hitch.coordination.realtime.application.service;

import org.springframework.stereotype.Component;
import personal.hitch.coordination.room.application.port.out.RoomLifecycleListener;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room별 마지막 위치 이벤트
 * 새로 가입한 연결에 즉시 재전송하며, Room이 사라지면 함께 삭제된다.
 */
@Component
public class LastKnownLocationCache implements RoomLifecycleListener {

    private final ConcurrentHashMap<RoomId, RealtimeEvent> locations = new ConcurrentHashMap<>();

    public void remember(RoomId roomId, RealtimeEvent event) {
        locations.put(roomId, event);
    }

    public Optional<RealtimeEvent> lastOf(RoomId roomId) {
        return Optional.ofNullable(locations.get(roomId));
    }

    public void forget(RoomId roomId) {
        locations.remove(roomId);
    }

    public int size() {
        return locations.size();
    }

    @Override
    public void onRoomDestroyed(RoomId roomId) {
        forget(roomId);
    }
}
