package com.ryuqq.agentsession.core.snapshot;

import com.ryuqq.agentsession.core.session.SessionEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 영속화되는 전체 상태.
 *
 * <pre>
 * {
 *   agentSessions:            { repoId: { sessionId: SessionSnapshot } },
 *   agentSessionEntries:      { repoId: { sessionId: [SessionEntry] } },
 *   childToParentAgentSession:{ childId: parentId },
 *   issueRepositoryCache:     { workItemId: repoId }
 * }
 * </pre>
 *
 * @param agentSessions 저장소별 세션
 * @param agentSessionEntries 저장소별 세션 기록
 * @param childToParentAgentSession 자식 → 부모 세션 매핑
 * @param issueRepositoryCache 작업 단위 → 저장소 매핑
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PersistedState(
    Map<String, Map<String, SessionSnapshot>> agentSessions,
    Map<String, Map<String, List<SessionEntry>>> agentSessionEntries,
    Map<String, String> childToParentAgentSession,
    Map<String, String> issueRepositoryCache
) {

    public PersistedState {
        agentSessions = agentSessions == null ? Map.of() : copy(agentSessions);
        agentSessionEntries = agentSessionEntries == null ? Map.of() : copy(agentSessionEntries);
        childToParentAgentSession = childToParentAgentSession == null
            ? Map.of() : Map.copyOf(childToParentAgentSession);
        issueRepositoryCache = issueRepositoryCache == null ? Map.of() : Map.copyOf(issueRepositoryCache);
    }

    /**
     * 빈 상태.
     *
     * @return 모든 맵이 빈 PersistedState
     */
    public static PersistedState empty() {
        return new PersistedState(Map.of(), Map.of(), Map.of(), Map.of());
    }

    /**
     * 부가 매핑을 교체한 새 상태.
     *
     * @param childToParent 자식 → 부모 매핑
     * @param issueRepositories 작업 단위 → 저장소 매핑
     * @return 새 PersistedState
     */
    public PersistedState withMappings(Map<String, String> childToParent, Map<String, String> issueRepositories) {
        return new PersistedState(agentSessions, agentSessionEntries, childToParent, issueRepositories);
    }

    /**
     * 전체 세션 수.
     *
     * @return 저장소 합산 세션 수
     */
    public int sessionCount() {
        return agentSessions.values().stream().mapToInt(Map::size).sum();
    }

    private static <V> Map<String, Map<String, V>> copy(Map<String, Map<String, V>> source) {
        Map<String, Map<String, V>> result = new LinkedHashMap<>();
        source.forEach((key, inner) -> result.put(key, inner == null ? Map.of() : new LinkedHashMap<>(inner)));
        return result;
    }
}
