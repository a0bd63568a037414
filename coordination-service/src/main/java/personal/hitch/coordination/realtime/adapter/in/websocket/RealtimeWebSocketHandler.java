package personal.hitch.coordination.realtime.adapter.in.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.presence.application.service.PresenceRegistry;
import personal.hitch.coordination.realtime.application.service.InboundEventRouter;
import personal.hitch.coordination.realtime.domain.model.InboundMessage;

import java.util.Map;

/**
 * Realtime WebSocket Handler (Driving Adapter)
 * 연결 수명 주기를 PresenceRegistry에 연결하고, 수신 프레임을 InboundEventRouter로 넘긴다.
 *
 * 핸드셰이크에 Authorization: Bearer 헤더가 있으면 연결 직후 인증한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final PresenceRegistry presenceRegistry;
    private final InboundEventRouter inboundEventRouter;
    private final RealtimeProperties realtimeProperties;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
                session,
                realtimeProperties.getSendTimeLimitMs(),
                realtimeProperties.getSendBufferSizeLimit());

        try {
            presenceRegistry.register(new WebSocketClientConnection(decorated, objectMapper));
        } catch (IllegalStateException e) {
            log.warn("Connection refused: sessionId={}, reason={}", session.getId(), e.getMessage());
            session.close(CloseStatus.SERVICE_RESTARTED);
            return;
        }
        log.debug("Connection established: sessionId={}, remote={}", session.getId(), session.getRemoteAddress());

        String authorization = session.getHandshakeHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            inboundEventRouter.authenticate(session.getId(), authorization.substring(BEARER_PREFIX.length()));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        InboundMessage inbound;
        try {
            inbound = parse(message.getPayload());
        } catch (BusinessException e) {
            log.warn("Malformed frame: sessionId={}, reason={}", session.getId(), e.getMessage());
            inboundEventRouter.reject(session.getId(), e);
            return;
        }
        inboundEventRouter.route(session.getId(), inbound);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error: sessionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        inboundEventRouter.disconnected(session.getId());
        presenceRegistry.forget(session.getId());
        log.debug("Connection closed: sessionId={}, status={}", session.getId(), status);
    }

    /**
     * {type, payload} 봉투 해석
     * JSON 객체가 아닌 프레임(null, 배열, 스칼라)은 INVALID_INPUT
     */
    private InboundMessage parse(String payload) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Frame is not valid JSON", e);
        }
        if (frame == null || !frame.isObject()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Frame must be a JSON object");
        }

        JsonNode type = frame.get("type");
        JsonNode body = frame.get("payload");
        Map<String, Object> fields = null;
        if (body != null && !body.isNull()) {
            if (!body.isObject()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "payload must be an object");
            }
            fields = objectMapper.convertValue(body, PAYLOAD_TYPE);
        }
        return new InboundMessage(type == null || !type.isTextual() ? null : type.asText(), fields);
    }
}
