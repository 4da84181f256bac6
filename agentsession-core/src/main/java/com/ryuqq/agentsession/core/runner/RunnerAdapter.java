package com.ryuqq.agentsession.core.runner;

import com.ryuqq.agentsession.core.message.CanonicalMessage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 백엔드 1회 호출을 감싸는 어댑터 계약.
 *
 * <p>모든 백엔드 구현은 다음을 보장해야 합니다:</p>
 * <ul>
 *   <li>모든 메시지 시퀀스는 정확히 하나의 SystemInit으로 시작</li>
 *   <li>정확히 하나의 ResultMessage로 끝남 (중단 시 오류 Result는 합성하지 않음)</li>
 *   <li>correlation id 당 AssistantToolUse와 UserToolResult는 각각 최대 1회, 항상 이 순서</li>
 *   <li>{@link #getMessages()}는 호출마다 동일한 스냅샷 복사본 반환</li>
 * </ul>
 *
 * <p><strong>실패 의미론:</strong></p>
 * <ul>
 *   <li>기동/핸드셰이크 실패: 메시지 발행 전에 {@link RunnerStartException}</li>
 *   <li>실행 중 실패: 오류 ResultMessage + {@link RunnerListener#onError}</li>
 *   <li>중단: 오류로 취급하지 않음</li>
 * </ul>
 *
 * <p>인스턴스는 한 번의 호출에만 사용되며, resume 시 새 인스턴스로 교체됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RunnerAdapter {

    /**
     * 백엔드 유형.
     *
     * @return BackendType
     */
    BackendType backendType();

    /**
     * 실행 중 입력 추가를 지원하는지 여부.
     *
     * @return 지원하면 true
     */
    boolean supportsStreamingInput();

    /**
     * 새 호출 시작.
     *
     * <p>반환된 future는 실행이 끝나면 (성공/실패/중단 무관) 완료됩니다.</p>
     *
     * @param prompt 프롬프트
     * @return 종료 시 완료되는 handle
     * @throws RunnerStartException 이미 실행 중이거나 백엔드를 시작할 수 없는 경우
     */
    CompletableFuture<RunnerSessionInfo> start(String prompt);

    /**
     * 실행 중 입력을 받을 수 있는 호출 시작.
     *
     * @param prompt 초기 프롬프트
     * @return 종료 시 완료되는 handle
     * @throws StreamingInputUnsupportedException 스트리밍을 지원하지 않는 경우
     * @throws RunnerStartException 이미 실행 중이거나 백엔드를 시작할 수 없는 경우
     */
    CompletableFuture<RunnerSessionInfo> startStreaming(String prompt);

    /**
     * 실행 중인 스트리밍 호출에 입력 추가.
     *
     * @param text 추가 입력
     * @throws StreamingInputUnsupportedException 스트리밍 호출이 실행 중이 아닌 경우
     */
    void addStreamMessage(String text);

    /**
     * 스트리밍 입력 종료 (더 이상 입력 없음).
     */
    void completeStream();

    /**
     * 중단 요청 (idempotent).
     *
     * <p>백엔드가 즉시 멈추는 것을 보장하지 않지만, 이후 종료 Result 외의 메시지는 발행되지 않습니다.</p>
     */
    void stop();

    /**
     * 실행 중인지 확인.
     *
     * @return STARTING 또는 RUNNING이면 true
     */
    boolean isRunning();

    /**
     * 현재 상태.
     *
     * @return RunnerState
     */
    RunnerState state();

    /**
     * 지금까지 발행된 전체 메시지 (발행 순서, 복사본).
     *
     * @return 메시지 목록
     */
    List<CanonicalMessage> getMessages();

    /**
     * 이벤트 수신자 등록.
     *
     * @param listener 수신자
     */
    void addListener(RunnerListener listener);
}
