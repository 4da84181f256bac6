package com.ryuqq.agentsession.adapter.runner.support;

/**
 * 백엔드 프로세스 종료 정보.
 *
 * @param exitCode 종료 코드 (알 수 없으면 -1)
 * @param stopped 호출자가 중단을 요청했는지 여부
 * @param failureMessage 전송 계층 실패 메시지 (예: "cursor-agent exited with code 2", null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunTermination(int exitCode, boolean stopped, String failureMessage) {

    /**
     * 비정상 종료인지 확인.
     *
     * @return 중단이 아니고 실패 메시지가 있으면 true
     */
    public boolean isFailure() {
        return !stopped && failureMessage != null;
    }
}
