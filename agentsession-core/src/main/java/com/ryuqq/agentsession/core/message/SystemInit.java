package com.ryuqq.agentsession.core.message;

import java.util.List;

/**
 * 세션 시작 메시지.
 *
 * <p>백엔드가 세션 식별자를 처음 확정했을 때 발행되며, 확정 전에 실패한 경우
 * 종료 시점에 최선의 ID(없으면 {@value #PENDING_SESSION_ID})로 합성됩니다.</p>
 *
 * @param sessionId 백엔드 세션 ID (resume handle로 사용)
 * @param model 사용 모델 (null 가능)
 * @param tools 사용 가능한 도구 목록
 * @param permissionMode 권한 모드 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SystemInit(
    String sessionId,
    String model,
    List<String> tools,
    String permissionMode
) implements CanonicalMessage {

    /**
     * 세션 ID가 확정되지 않은 경우 사용되는 placeholder.
     */
    public static final String PENDING_SESSION_ID = "pending";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException sessionId가 null이거나 빈 문자열인 경우
     */
    public SystemInit {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    /**
     * 모델 정보만으로 SystemInit 생성.
     *
     * @param sessionId 세션 ID
     * @param model 모델명
     * @return SystemInit 인스턴스
     */
    public static SystemInit of(String sessionId, String model) {
        return new SystemInit(sessionId, model, List.of(), null);
    }

    /**
     * 세션 ID가 placeholder인지 확인.
     *
     * @return "pending"이면 true
     */
    public boolean isPending() {
        return PENDING_SESSION_ID.equals(sessionId);
    }
}
