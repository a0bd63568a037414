package personal.hitch.coordination.realtime.adapter.in.websocket;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 실시간 연결 설정 Properties
 *
 * 설정 예시:
 * realtime:
 *   endpoint: /ws
 *   allowed-origins: ["*"]
 *   send-time-limit-ms: 5000
 *   send-buffer-size-limit: 524288
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    private String endpoint = "/ws";

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /**
     * 한 번의 전송이 이 시간을 넘기면 느린 연결로 보고 닫는다
     */
    private int sendTimeLimitMs = 5000;

    /**
     * 전송 대기 버퍼 한도 (byte), 초과 시 연결 종료
     */
    private int sendBufferSizeLimit = 512 * 1024;
}
