package personal.hitch.coordination.presence.application.port.out;

/**
 * 자격 증명 검증 Port
 * 외부 인증 서비스에 자격 증명(토큰)을 검증받고 사용자 ID를 얻는다.
 */
public interface CredentialVerifier {

    /**
     * @param credential 클라이언트가 제시한 자격 증명
     * @return 검증된 사용자 ID
     * @throws personal.hitch.coordination.presence.domain.exception.AuthenticationFailedException 자격 증명이 유효하지 않을 때
     * @throws personal.hitch.common.exception.UpstreamUnavailableException 인증 서비스에 도달할 수 없을 때
     */
    Long verify(String credential);
}
