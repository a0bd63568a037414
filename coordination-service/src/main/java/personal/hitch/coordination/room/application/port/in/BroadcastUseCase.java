package personal.hitch.coordination.room.application.port.in;

import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;

/**
 * Room 브로드캐스트 Use Case
 * 상태 변경을 수행한 서비스가 커밋 이후 관심 있는 참여자에게 이벤트를 전파할 때 사용
 */
public interface BroadcastUseCase {

    /**
     * Room의 현재 멤버 전체에게 이벤트 전송
     *
     * @return 전송에 성공한 연결 수
     */
    int broadcast(RoomId roomId, RealtimeEvent event);
}
