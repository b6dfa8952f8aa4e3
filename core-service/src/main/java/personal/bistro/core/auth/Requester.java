package personal.bistro.core.auth;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 인증이 끝난 요청자 정보
 * 인증/세션 발급은 외부(게이트웨이)에서 수행하고, 이 서비스는 사용자 ID와 관리자 여부만 전달받는다.
 *
 * @param userId 인증된 사용자 ID
 * @param admin  관리자 권한 보유 여부
 */
public record Requester(Long userId, boolean admin) {

    public static final String ADMIN_ROLE = "ADMIN";

    public Requester {
        if (userId == null) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "User ID cannot be null");
        }
    }

    /**
     * X-User-Id / X-User-Role 헤더 값으로 요청자 생성
     */
    public static Requester of(Long userId, String role) {
        return new Requester(userId, ADMIN_ROLE.equalsIgnoreCase(role));
    }

    public static Requester user(Long userId) {
        return new Requester(userId, false);
    }

    public static Requester admin(Long userId) {
        return new Requester(userId, true);
    }

    /**
     * 관리자 권한 검증
     *
     * @throws BusinessException FORBIDDEN - 관리자가 아닐 때
     */
    public void ensureAdmin() {
        if (!admin) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    String.format("Admin role required: userId=%d", userId));
        }
    }
}
