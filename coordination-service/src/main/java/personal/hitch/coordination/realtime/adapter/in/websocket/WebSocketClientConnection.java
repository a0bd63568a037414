package personal.hitch.coordination.realtime.adapter.in.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import personal.hitch.coordination.presence.application.port.out.ClientConnection;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebSocket Client Connection
 * ConcurrentWebSocketSessionDecorator로 감싼 세션 위의 ClientConnection 구현
 * 프레임: {"type": ..., "payload": {...}, "occurredAt": ...}
 */
@Slf4j
public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketClientConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(RealtimeEvent event) throws IOException {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.type());
        frame.put("payload", event.payload());
        frame.put("occurredAt", event.occurredAt().toString());
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL.withReason(reason));
        } catch (IOException e) {
            log.debug("Failed to close websocket session: sessionId={}, reason={}", session.getId(), reason, e);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
