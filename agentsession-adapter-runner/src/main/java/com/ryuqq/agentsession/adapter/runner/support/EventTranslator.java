package com.ryuqq.agentsession.adapter.runner.support;

import com.ryuqq.agentsession.core.message.CanonicalMessage;

import java.util.List;

/**
 * 백엔드 stdout 한 줄을 정규 메시지로 변환.
 *
 * <p>한 번의 실행에만 사용되며, 원시 payload는 이 경계를 넘지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventTranslator {

    /**
     * 출력 한 줄 변환.
     *
     * @param line stdout 한 줄
     * @return 발행할 메시지 (없으면 빈 목록)
     */
    List<CanonicalMessage> translate(String line);

    /**
     * 종료 처리: 누락된 SystemInit과 종료 Result를 합성.
     *
     * @param termination 종료 정보
     * @return 마지막으로 발행할 메시지
     */
    List<CanonicalMessage> finish(RunTermination termination);

    /**
     * 백엔드가 종료 이벤트(result)를 보냈는지 여부.
     *
     * @return 보냈으면 true
     */
    boolean isTerminalEventSeen();

    /**
     * 현재까지 알려진 최선의 세션 ID.
     *
     * @return 세션 ID (확정 전이면 resume ID 또는 "pending")
     */
    String currentSessionId();
}
