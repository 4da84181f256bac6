package com.ryuqq.agentsession.core.activity;

/**
 * 게시할 activity 본문.
 *
 * <p>ACTION 유형은 {@code action}/{@code parameter}/{@code result}를, 나머지 유형은 {@code body}를 사용합니다.</p>
 *
 * @param type 유형
 * @param body 본문 (ACTION 외)
 * @param action 도구/행동 이름 (ACTION 전용)
 * @param parameter 행동 파라미터 (ACTION 전용)
 * @param result 행동 결과 (ACTION 전용, 진행 중이면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActivityContent(
    ActivityType type,
    String body,
    String action,
    String parameter,
    String result
) {

    public ActivityContent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == ActivityType.ACTION && (action == null || action.isBlank())) {
            throw new IllegalArgumentException("action cannot be null or blank for ACTION activity");
        }
    }

    public static ActivityContent thought(String body) {
        return new ActivityContent(ActivityType.THOUGHT, body, null, null, null);
    }

    public static ActivityContent response(String body) {
        return new ActivityContent(ActivityType.RESPONSE, body, null, null, null);
    }

    public static ActivityContent error(String body) {
        return new ActivityContent(ActivityType.ERROR, body, null, null, null);
    }

    public static ActivityContent elicitation(String body) {
        return new ActivityContent(ActivityType.ELICITATION, body, null, null, null);
    }

    public static ActivityContent action(String action, String parameter, String result) {
        return new ActivityContent(ActivityType.ACTION, null, action, parameter == null ? "" : parameter, result);
    }
}
