package personal.hitch.coordination.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import personal.hitch.coordination.realtime.adapter.in.websocket.RealtimeProperties;
import personal.hitch.coordination.realtime.adapter.in.websocket.RealtimeWebSocketHandler;

/**
 * WebSocket Configuration
 * 실시간 연결 엔드포인트 등록 (기본: /ws)
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler realtimeWebSocketHandler;
    private final RealtimeProperties realtimeProperties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(realtimeWebSocketHandler, realtimeProperties.getEndpoint())
                .setAllowedOriginPatterns(realtimeProperties.getAllowedOrigins().toArray(String[]::new));
    }
}
