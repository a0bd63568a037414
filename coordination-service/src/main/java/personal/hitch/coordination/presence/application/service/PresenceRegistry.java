package personal.hitch.coordination.presence.application.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;
import personal.hitch.coordination.presence.application.port.out.ClientConnection;
import personal.hitch.coordination.presence.application.port.out.CredentialVerifier;
import personal.hitch.coordination.presence.domain.exception.AuthenticationFailedException;
import personal.hitch.coordination.room.application.service.RoomBroadcastManager;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Presence Registry
 * 사용자 ↔ 연결 매핑 관리
 *
 * - connection -> user: ConnectionRegistry 슬롯에 저장
 * - user -> connection: 사용자당 최신 연결 하나 (last-writer-wins)
 *
 * 자격 증명 검증(외부 호출) 중에는 어떤 락도 잡지 않는다.
 * 같은 사용자의 이전 연결이 늦게 끊겨도 최신 매핑은 지워지지 않는다 (조건부 remove).
 */
@Slf4j
@Service
public class PresenceRegistry implements SmartLifecycle {

    private final ConcurrentHashMap<Long, String> userConnections = new ConcurrentHashMap<>();
    private final ConnectionRegistry connectionRegistry;
    private final RoomBroadcastManager roomBroadcastManager;
    private final CredentialVerifier credentialVerifier;
    private volatile boolean running;

    public PresenceRegistry(ConnectionRegistry connectionRegistry,
                            RoomBroadcastManager roomBroadcastManager,
                            CredentialVerifier credentialVerifier,
                            MeterRegistry meterRegistry) {
        this.connectionRegistry = connectionRegistry;
        this.roomBroadcastManager = roomBroadcastManager;
        this.credentialVerifier = credentialVerifier;
        Gauge.builder("presence.online.users", userConnections, ConcurrentHashMap::size)
                .description("Users with a live authenticated connection")
                .register(meterRegistry);
    }

    /**
     * 새 연결 등록 (미인증 상태)
     *
     * @throws IllegalStateException 레지스트리가 중지된 상태일 때
     */
    public void register(ClientConnection connection) {
        if (!running) {
            throw new IllegalStateException("Presence registry is not running");
        }
        connectionRegistry.register(connection);
    }

    /**
     * 연결 인증
     * 성공 시 userId -> connectionId 매핑을 최신 연결로 갱신한다.
     *
     * @return 인증된 사용자 ID
     * @throws AuthenticationFailedException 자격 증명이 거부되었거나 검증 도중 연결이 끊긴 경우
     */
    public Long authenticate(String connectionId, String credential) {
        if (!connectionRegistry.isActive(connectionId)) {
            throw new AuthenticationFailedException("connection is not registered");
        }
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationFailedException("credential is missing");
        }

        // 외부 호출 (락 없음)
        Long userId = credentialVerifier.verify(credential);

        // 같은 연결이 다른 사용자로 재인증하는 경우 이전 매핑 정리
        connectionRegistry.userOf(connectionId)
                .filter(previousUser -> !previousUser.equals(userId))
                .ifPresent(previousUser -> userConnections.remove(previousUser, connectionId));

        if (!connectionRegistry.bindUser(connectionId, userId)) {
            throw new AuthenticationFailedException("connection closed during authentication");
        }

        String superseded = userConnections.put(userId, connectionId);
        if (superseded != null && !superseded.equals(connectionId)) {
            log.info("Presence superseded: userId={}, previousConnectionId={}, connectionId={}",
                    userId, superseded, connectionId);
        }

        // 검증 도중 끊긴 연결이 매핑에 남지 않도록 재확인
        if (!connectionRegistry.isActive(connectionId)) {
            userConnections.remove(userId, connectionId);
            throw new AuthenticationFailedException("connection closed during authentication");
        }

        log.info("Connection authenticated: connectionId={}, userId={}", connectionId, userId);
        return userId;
    }

    /**
     * 사용자의 현재 연결 조회
     */
    public Optional<String> resolve(Long userId) {
        return Optional.ofNullable(userConnections.get(userId));
    }

    public Optional<Long> userOf(String connectionId) {
        return connectionRegistry.userOf(connectionId);
    }

    public boolean isOnline(Long userId) {
        return userConnections.containsKey(userId);
    }

    public int onlineUserCount() {
        return userConnections.size();
    }

    /**
     * 연결 정리 (끊김 시, 멱등)
     * 모든 Room에서 탈퇴시키고, 해당 연결을 가리키는 사용자 매핑만 제거한다.
     */
    public void forget(String connectionId) {
        connectionRegistry.markClosing(connectionId);
        roomBroadcastManager.leaveAll(connectionId);

        Optional<Long> userId = connectionRegistry.userOf(connectionId);
        connectionRegistry.unregister(connectionId);
        userId.ifPresent(user -> {
            if (userConnections.remove(user, connectionId)) {
                log.info("User went offline: userId={}, connectionId={}", user, connectionId);
            }
        });
        log.debug("Connection forgotten: connectionId={}", connectionId);
    }

    @Override
    public void start() {
        running = true;
        log.info("Presence registry started");
    }

    /**
     * 모든 연결을 닫고 Presence/Room 상태를 비운다.
     */
    @Override
    public void stop() {
        running = false;
        for (String connectionId : connectionRegistry.connectionIds()) {
            connectionRegistry.close(connectionId, "server shutdown");
            forget(connectionId);
        }
        userConnections.clear();
        roomBroadcastManager.clear();
        log.info("Presence registry stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
