package personal.hitch.coordination.room.application.port.out;

import personal.hitch.coordination.room.domain.model.RoomId;

/**
 * Room 생명주기 리스너
 * 마지막 멤버가 나가 Room이 삭제될 때 호출된다.
 */
public interface RoomLifecycleListener {

    void onRoomDestroyed(RoomId roomId);
}
