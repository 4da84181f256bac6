package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.core.session.TrackingMode;
import com.ryuqq.agentsession.core.session.WorkItem;
import com.ryuqq.agentsession.core.session.Workspace;

import java.util.List;

/**
 * SessionOrchestrator로 들어오는 외부/내부 이벤트.
 *
 * <p>외부 이벤트(세션 시작, 프롬프트, 중단, 할당 해제)는 팩토리 메서드로 생성하고,
 * 내부 이벤트(자식 결과, 검증 루프, 단계 전이)는 SessionManager 신호로부터 생성됩니다.</p>
 *
 * <pre>
 * InboundEvent start = InboundEvent.sessionStart("repo-1", workItem, null,
 *     "Fix the login bug", List.of("codex"), workItem.title(), TrackingMode.TRACKED);
 * InboundEvent prompt = InboundEvent.userPrompt(sessionId, "Also update the docs");
 * InboundEvent stop = InboundEvent.stopSignal(sessionId);
 * </pre>
 *
 * @param kind 이벤트 종류
 * @param repositoryId 저장소 ID (세션 시작에만 필요, 없으면 캐시에서 조회)
 * @param sessionId 대상 세션 ID (세션 시작/할당 해제는 null)
 * @param workItem 작업 항목 (세션 시작/할당 해제)
 * @param workspace 작업 디렉터리 (null이면 저장소 경로)
 * @param text 프롬프트 본문
 * @param labels 라우팅 라벨
 * @param description 라우팅 태그를 찾을 설명
 * @param trackingMode 진행 게시 여부
 * @param parentSessionId 자식 세션으로 시작할 때 부모 세션 ID
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InboundEvent(
    EventKind kind,
    String repositoryId,
    String sessionId,
    WorkItem workItem,
    Workspace workspace,
    String text,
    List<String> labels,
    String description,
    TrackingMode trackingMode,
    String parentSessionId
) {

    public InboundEvent {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if ((kind == EventKind.SESSION_START || kind == EventKind.UNASSIGN) && workItem == null) {
            throw new IllegalArgumentException("workItem cannot be null for " + kind);
        }
        if (kind != EventKind.SESSION_START && kind != EventKind.UNASSIGN
            && (sessionId == null || sessionId.isBlank())) {
            throw new IllegalArgumentException("sessionId cannot be null or blank for " + kind);
        }
        text = text == null ? "" : text;
        labels = labels == null ? List.of() : List.copyOf(labels);
        trackingMode = trackingMode == null ? TrackingMode.TRACKED : trackingMode;
    }

    public static InboundEvent sessionStart(String repositoryId, WorkItem workItem, Workspace workspace,
                                            String text, List<String> labels, String description,
                                            TrackingMode trackingMode) {
        return new InboundEvent(EventKind.SESSION_START, repositoryId, null, workItem, workspace,
            text, labels, description, trackingMode, null);
    }

    public static InboundEvent userPrompt(String sessionId, String text) {
        return of(EventKind.USER_PROMPT, sessionId, text);
    }

    public static InboundEvent stopSignal(String sessionId) {
        return of(EventKind.STOP_SIGNAL, sessionId, null);
    }

    public static InboundEvent unassign(WorkItem workItem) {
        return new InboundEvent(EventKind.UNASSIGN, null, null, workItem, null, null, List.of(), null, null, null);
    }

    public static InboundEvent childResult(String parentSessionId, String text) {
        return of(EventKind.CHILD_RESULT, parentSessionId, text);
    }

    public static InboundEvent validationFixer(String sessionId, String fixerPrompt) {
        return of(EventKind.VALIDATION_FIXER, sessionId, fixerPrompt);
    }

    public static InboundEvent validationRerun(String sessionId) {
        return of(EventKind.VALIDATION_RERUN, sessionId, null);
    }

    public static InboundEvent subroutineTransition(String sessionId) {
        return of(EventKind.SUBROUTINE_TRANSITION, sessionId, null);
    }

    /**
     * 부모 세션 아래의 자식 세션으로 시작하도록 복사.
     *
     * @param parentSessionId 부모 세션 ID
     * @return 새 이벤트
     */
    public InboundEvent withParent(String parentSessionId) {
        return new InboundEvent(kind, repositoryId, sessionId, workItem, workspace, text, labels,
            description, trackingMode, parentSessionId);
    }

    /**
     * 라우팅 신호를 덧붙여 복사 (사용자 프롬프트가 라벨을 함께 가져올 때).
     *
     * @param labels 라벨
     * @param description 설명
     * @return 새 이벤트
     */
    public InboundEvent withRouting(List<String> labels, String description) {
        return new InboundEvent(kind, repositoryId, sessionId, workItem, workspace, text, labels,
            description, trackingMode, parentSessionId);
    }

    private static InboundEvent of(EventKind kind, String sessionId, String text) {
        return new InboundEvent(kind, null, sessionId, null, null, text, List.of(), null, null, null);
    }
}
