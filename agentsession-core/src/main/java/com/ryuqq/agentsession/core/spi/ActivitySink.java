package com.ryuqq.agentsession.core.spi;

import com.ryuqq.agentsession.core.activity.ActivityContent;
import com.ryuqq.agentsession.core.activity.ActivityPostOptions;
import com.ryuqq.agentsession.core.activity.ActivityPostResult;

/**
 * 외부 트래커로 진행 상황을 게시하는 협력자.
 *
 * <p>구현체는 네트워크 오류 등을 예외로 던질 수 있으며, 호출자(SessionManager)는
 * 이를 로깅만 하고 세션 처리를 계속합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ActivitySink {

    /**
     * activity 게시.
     *
     * @param externalSessionId 외부 세션 ID
     * @param content 본문
     * @param options 옵션
     * @return 게시 결과
     */
    ActivityPostResult postActivity(String externalSessionId, ActivityContent content, ActivityPostOptions options);

    /**
     * 작업 단위에 대한 외부 세션 생성.
     *
     * @param workItemId 작업 단위 ID
     * @return 외부 세션 ID
     */
    String createAgentSession(String workItemId);
}
