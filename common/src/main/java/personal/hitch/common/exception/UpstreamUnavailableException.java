package personal.hitch.common.exception;

/**
 * Upstream Unavailable Exception
 * 외부 협력 서비스(인증, 결제 대행, 푸시)에 도달할 수 없을 때 발생
 * HTTP 503 반환용, 호출자는 재시도할 수 있다.
 */
public class UpstreamUnavailableException extends BusinessException {

    public UpstreamUnavailableException(String upstream) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE,
                String.format("Upstream service unavailable: %s", upstream));
    }

    public UpstreamUnavailableException(String upstream, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE,
                String.format("Upstream service unavailable: %s", upstream), cause);
    }
}
