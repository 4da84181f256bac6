package com.ryuqq.agentsession.core.spi;

import com.ryuqq.agentsession.core.snapshot.PersistedState;

import java.util.Optional;

/**
 * 전체 세션 상태의 버전 있는 영속화.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #load()}는 예외를 던지지 않음 (파일 없음, 손상, 알 수 없는 버전 → empty)</li>
 *   <li>이전 버전 스냅샷은 현재 버전으로 변환되어 즉시 재저장됨</li>
 *   <li>{@link #save}는 스냅샷 전체를 원자적으로 대체</li>
 * </ul>
 *
 * <p>영속화는 best-effort입니다. 크래시 간 exactly-once는 보장하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionStore {

    /**
     * 현재 스냅샷 버전.
     */
    String CURRENT_VERSION = "3.0";

    /**
     * 스냅샷 로드.
     *
     * @return 상태, 없거나 읽을 수 없으면 empty
     */
    Optional<PersistedState> load();

    /**
     * 스냅샷 저장.
     *
     * @param state 전체 상태
     * @throws com.ryuqq.agentsession.core.snapshot.SnapshotPersistenceException 쓰기에 실패한 경우
     */
    void save(PersistedState state);
}
