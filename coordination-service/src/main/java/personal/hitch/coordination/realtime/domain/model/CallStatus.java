package personal.hitch.coordination.realtime.domain.model;

/**
 * 통화 상태
 * 종료/거절된 통화는 레지스트리에서 제거되므로 별도 상태를 두지 않는다.
 */
public enum CallStatus {
    RINGING,
    ACTIVE
}
