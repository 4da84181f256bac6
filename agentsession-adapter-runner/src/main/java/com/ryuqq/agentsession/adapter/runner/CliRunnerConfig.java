package com.ryuqq.agentsession.adapter.runner;

import java.util.Map;

/**
 * 백엔드 CLI 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>claudePath / codexPath / cursorPath / geminiPath: 실행 파일 경로</li>
 *   <li>cursorAgentVersion: 검증된 cursor-agent 버전 (null이면 버전 확인 생략)</li>
 *   <li>defaultCodexModel / defaultGeminiModel: 모델 미지정 시 사용</li>
 *   <li>environment: 모든 백엔드 프로세스에 추가할 환경 변수</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param claudePath Claude CLI 경로
 * @param codexPath Codex CLI 경로
 * @param cursorPath cursor-agent 경로
 * @param cursorAgentVersion 기대하는 cursor-agent 버전 (null 가능)
 * @param geminiPath Gemini CLI 경로
 * @param defaultCodexModel Codex 기본 모델
 * @param defaultGeminiModel Gemini 기본 모델
 * @param environment 추가 환경 변수
 */
public record CliRunnerConfig(
    String claudePath,
    String codexPath,
    String cursorPath,
    String cursorAgentVersion,
    String geminiPath,
    String defaultCodexModel,
    String defaultGeminiModel,
    Map<String, String> environment
) {

    /**
     * 검증된 cursor-agent 버전.
     */
    public static final String TESTED_CURSOR_AGENT_VERSION = "2026.02.13-41ac335";

    /**
     * 기본 설정 생성자.
     *
     * <p>PATH 상의 claude, codex, cursor-agent, gemini를 사용합니다.</p>
     */
    public CliRunnerConfig() {
        this("claude", "codex", "cursor-agent", TESTED_CURSOR_AGENT_VERSION, "gemini",
            "gpt-5.3-codex", "gemini-2.5-pro", Map.of());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 실행 파일 경로가 비어 있는 경우
     */
    public CliRunnerConfig {
        requirePath("claudePath", claudePath);
        requirePath("codexPath", codexPath);
        requirePath("cursorPath", cursorPath);
        requirePath("geminiPath", geminiPath);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliRunnerConfig withClaudePath(String claudePath) {
        return new CliRunnerConfig(claudePath, codexPath, cursorPath, cursorAgentVersion, geminiPath,
            defaultCodexModel, defaultGeminiModel, environment);
    }

    public CliRunnerConfig withCursorAgentVersion(String cursorAgentVersion) {
        return new CliRunnerConfig(claudePath, codexPath, cursorPath, cursorAgentVersion, geminiPath,
            defaultCodexModel, defaultGeminiModel, environment);
    }

    public CliRunnerConfig withEnvironment(Map<String, String> environment) {
        return new CliRunnerConfig(claudePath, codexPath, cursorPath, cursorAgentVersion, geminiPath,
            defaultCodexModel, defaultGeminiModel, environment);
    }

    private static void requirePath(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
