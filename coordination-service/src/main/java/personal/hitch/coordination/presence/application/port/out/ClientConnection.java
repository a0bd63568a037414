package personal.hitch.coordination.presence.application.port.out;

import personal.hitch.coordination.room.domain.model.RealtimeEvent;

import java.io.IOException;

/**
 * Client Connection Port
 * 전송 계층(WebSocket 등)의 연결 핸들
 * Presence/Room은 연결을 ID로만 참조하고 실제 쓰기는 이 포트를 통해 수행한다.
 */
public interface ClientConnection {

    /**
     * 불투명한 연결 ID
     */
    String id();

    /**
     * 이벤트 전송
     * 구현체는 동시 호출에 안전해야 하며, 같은 스레드에서 호출된 순서를 보존해야 한다.
     *
     * @throws IOException 전송 실패 시
     */
    void send(RealtimeEvent event) throws IOException;

    /**
     * 연결 종료 (이미 닫혀 있으면 무시)
     */
    void close(String reason);

    boolean isOpen();
}
