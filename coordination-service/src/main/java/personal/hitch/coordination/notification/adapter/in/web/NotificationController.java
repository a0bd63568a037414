package personal.hitch.coordination.notification.adapter.in.web;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.notification.adapter.in.web.dto.NotificationResponse;
import personal.hitch.coordination.notification.application.port.in.GetNotificationsUseCase;

import java.util.List;

/**
 * Notification API Controller
 * 본인 알림만 조회할 수 있다.
 */
@Validated
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class NotificationController {

    private final GetNotificationsUseCase getNotificationsUseCase;

    /**
     * 최근 알림 조회
     * GET /api/v1/users/{userId}/notifications?limit=20
     */
    @GetMapping("/{userId}/notifications")
    public ResponseEntity<List<NotificationResponse>> recent(
            @PathVariable Long userId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestHeader("X-User-Id") Long requesterId
    ) {
        if (!userId.equals(requesterId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    String.format("Cannot read notifications of another user: userId=%d", userId));
        }
        return ResponseEntity.ok(getNotificationsUseCase.recent(userId, limit).stream()
                .map(NotificationResponse::from)
                .toList());
    }
}
