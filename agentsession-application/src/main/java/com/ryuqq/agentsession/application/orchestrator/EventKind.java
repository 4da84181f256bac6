package com.ryuqq.agentsession.application.orchestrator;

/**
 * SessionOrchestrator가 처리하는 이벤트 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventKind {

    /** 작업 항목에 처음 할당됨 (세션 생성). */
    SESSION_START,

    /** 기존 세션에 대한 사용자 프롬프트. */
    USER_PROMPT,

    /** 중단 요청. 라우팅을 거치지 않습니다. */
    STOP_SIGNAL,

    /** 작업 항목 할당 해제. 해당 작업 항목의 모든 활성 세션을 중단합니다. */
    UNASSIGN,

    /** 자식 세션 결과로 부모 세션 재개. */
    CHILD_RESULT,

    /** 검증 실패 후 fixer 실행. */
    VALIDATION_FIXER,

    /** fixer 종료 후 검증 단계 재실행. */
    VALIDATION_RERUN,

    /** 단계 완료 후 다음 단계 실행. */
    SUBROUTINE_TRANSITION;

    /**
     * 재분류 없이 미리 정해진 단계를 실행하는 이벤트인지 여부.
     *
     * @return 재분류를 건너뛰면 true
     */
    public boolean forcesPlannedSubroutine() {
        return this == CHILD_RESULT || this == VALIDATION_FIXER
            || this == VALIDATION_RERUN || this == SUBROUTINE_TRANSITION;
    }
}
