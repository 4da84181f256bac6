package com.ryuqq.agentsession.core.runner;

import java.util.Locale;
import java.util.Optional;

/**
 * 에이전트 백엔드 유형.
 *
 * <p>각 백엔드는 RunnerAdapter 구현 하나와 1:1로 대응되며,
 * 영속화 시 백엔드별 resume handle 필드 이름을 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BackendType {

    CLAUDE("claude", "Claude", "claudeSessionId"),
    CODEX("codex", "Codex", "codexSessionId"),
    CURSOR("cursor", "Cursor", "cursorSessionId"),
    GEMINI("gemini", "Gemini", "geminiSessionId");

    private final String key;
    private final String displayName;
    private final String resumeField;

    BackendType(String key, String displayName, String resumeField) {
        this.key = key;
        this.displayName = displayName;
        this.resumeField = resumeField;
    }

    /**
     * 라벨/태그에서 사용하는 소문자 키.
     *
     * @return 키 (예: "codex")
     */
    public String key() {
        return key;
    }

    /**
     * 사용자 노출용 이름.
     *
     * @return 표시 이름 (예: "Codex")
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 스냅샷에서 resume handle을 담는 필드 이름.
     *
     * @return 필드 이름 (예: "codexSessionId")
     */
    public String resumeField() {
        return resumeField;
    }

    /**
     * 키로부터 변환 (대소문자 무시).
     *
     * @param key 키 (null 가능)
     * @return 일치하는 BackendType
     */
    public static Optional<BackendType> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (BackendType type : values()) {
            if (type.key.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
