package com.ryuqq.agentsession.adapter.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.agentsession.core.session.IssueContext;

import java.util.Iterator;
import java.util.Map;

/**
 * 스냅샷 JSON 마이그레이션.
 *
 * <p><strong>v2.0 → v3.0:</strong></p>
 * <ul>
 *   <li>{@code linearAgentActivitySessionId} → {@code id}, {@code externalSessionId}</li>
 *   <li>{@code issueContext{trackerId: "linear", issueId, issueIdentifier}} 추가
 *       (identifier가 없으면 issueId)</li>
 *   <li>기존 필드와 {@code agentSessionEntries}, {@code childToParentAgentSession},
 *       {@code issueRepositoryCache}는 그대로 유지</li>
 * </ul>
 *
 * <p>JSON 트리 수준에서 동작하므로 v2 전용 필드도 잃지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SnapshotMigrator {

    static final String LEGACY_SESSION_ID_FIELD = "linearAgentActivitySessionId";

    private SnapshotMigrator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * v2 state 객체를 v3 형태로 변환 (입력은 수정하지 않음).
     *
     * @param v2State v2 {@code state} 객체
     * @return v3 {@code state} 객체
     */
    public static ObjectNode migrateV2ToV3(ObjectNode v2State) {
        ObjectNode migrated = v2State.deepCopy();
        JsonNode sessions = v2State.get("agentSessions");
        if (sessions == null || !sessions.isObject()) {
            return migrated;
        }

        ObjectNode migratedSessions = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> repositories = sessions.fields();
        while (repositories.hasNext()) {
            Map.Entry<String, JsonNode> repository = repositories.next();
            ObjectNode repositorySessions = migratedSessions.putObject(repository.getKey());
            if (!repository.getValue().isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> entries = repository.getValue().fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                if (!entry.getValue().isObject()) {
                    continue;
                }
                ObjectNode session = migrateSession((ObjectNode) entry.getValue(), entry.getKey());
                repositorySessions.set(session.get("id").asText(), session);
            }
        }
        migrated.set("agentSessions", migratedSessions);
        return migrated;
    }

    /**
     * v2 세션 1건 변환.
     *
     * @param v2Session v2 세션
     * @param fallbackId legacy ID 필드가 없을 때 쓸 ID (맵 키)
     * @return v3 세션
     */
    static ObjectNode migrateSession(ObjectNode v2Session, String fallbackId) {
        ObjectNode session = v2Session.deepCopy();
        String legacyId = textOrNull(v2Session, LEGACY_SESSION_ID_FIELD);
        String id = legacyId != null ? legacyId : fallbackId;
        session.put("id", id);
        session.put("externalSessionId", id);

        String issueId = textOrNull(v2Session, "issueId");
        JsonNode issue = v2Session.get("issue");
        String identifier = issue != null && issue.isObject() ? textOrNull(issue, "identifier") : null;
        ObjectNode issueContext = session.putObject("issueContext");
        issueContext.put("trackerId", IssueContext.DEFAULT_TRACKER);
        issueContext.put("issueId", issueId);
        issueContext.put("issueIdentifier", identifier != null ? identifier : issueId);
        return session;
    }

    /**
     * 버전과 무관하게 적용하는 필드 별칭 정리.
     *
     * <p>{@code workspace.isGitWorktree} → {@code workspace.gitWorktree}</p>
     *
     * @param session 세션 객체 (직접 수정)
     */
    static void normalizeSession(ObjectNode session) {
        JsonNode workspace = session.get("workspace");
        if (workspace instanceof ObjectNode) {
            ObjectNode node = (ObjectNode) workspace;
            if (!node.has("gitWorktree") && node.has("isGitWorktree")) {
                node.set("gitWorktree", node.get("isGitWorktree"));
            }
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
