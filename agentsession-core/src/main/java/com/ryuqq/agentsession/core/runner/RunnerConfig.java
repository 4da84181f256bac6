package com.ryuqq.agentsession.core.runner;

import java.nio.file.Path;
import java.util.List;

/**
 * 백엔드 호출 1회에 대한 실행 설정.
 *
 * <p>Orchestrator가 라우팅 결과와 subroutine 플래그로부터 조립합니다.</p>
 *
 * <p><strong>도구 제한:</strong></p>
 * <ul>
 *   <li>{@code disallowAllTools=true}: allowedTools가 비어 있는 것으로 취급</li>
 *   <li>{@code allowedTools}가 빈 리스트이고 disallowAllTools=false이면 백엔드 기본값</li>
 * </ul>
 *
 * @param workingDirectory 작업 디렉터리 (경로 상대화 기준)
 * @param model 모델 (null이면 백엔드 기본값)
 * @param fallbackModel 대체 모델 (null 가능)
 * @param resumeSessionId 이어서 실행할 백엔드 세션 ID (null이면 새 세션)
 * @param allowedTools 허용 도구
 * @param disallowedTools 금지 도구
 * @param allowedDirectories 추가 접근 허용 디렉터리 (순서 유지, 중복 없음)
 * @param maxTurns 최대 turn 수 (null이면 제한 없음)
 * @param appendSystemPrompt 시스템 프롬프트 추가분 (null 가능)
 * @param disallowAllTools 모든 도구 금지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunnerConfig(
    Path workingDirectory,
    String model,
    String fallbackModel,
    String resumeSessionId,
    List<String> allowedTools,
    List<String> disallowedTools,
    List<Path> allowedDirectories,
    Integer maxTurns,
    String appendSystemPrompt,
    boolean disallowAllTools
) {

    public RunnerConfig {
        if (workingDirectory == null) {
            throw new IllegalArgumentException("workingDirectory cannot be null");
        }
        if (maxTurns != null && maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive (current: " + maxTurns + ")");
        }
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
        allowedDirectories = allowedDirectories == null ? List.of() : List.copyOf(allowedDirectories);
    }

    /**
     * 작업 디렉터리만 지정한 기본 설정.
     *
     * @param workingDirectory 작업 디렉터리
     * @return RunnerConfig
     */
    public static RunnerConfig of(Path workingDirectory) {
        return new RunnerConfig(workingDirectory, null, null, null, List.of(), List.of(), List.of(), null, null, false);
    }

    public RunnerConfig withModel(String model) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withFallbackModel(String fallbackModel) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withResumeSessionId(String resumeSessionId) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withAllowedTools(List<String> allowedTools) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withDisallowedTools(List<String> disallowedTools) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withAllowedDirectories(List<Path> allowedDirectories) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withMaxTurns(Integer maxTurns) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withAppendSystemPrompt(String appendSystemPrompt) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    public RunnerConfig withDisallowAllTools(boolean disallowAllTools) {
        return new RunnerConfig(workingDirectory, model, fallbackModel, resumeSessionId, allowedTools,
            disallowedTools, allowedDirectories, maxTurns, appendSystemPrompt, disallowAllTools);
    }

    /**
     * resume 여부.
     *
     * @return resumeSessionId가 있으면 true
     */
    public boolean isResume() {
        return resumeSessionId != null && !resumeSessionId.isBlank();
    }
}
