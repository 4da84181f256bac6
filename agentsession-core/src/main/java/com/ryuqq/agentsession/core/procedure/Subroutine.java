package com.ryuqq.agentsession.core.procedure;

import java.util.List;

/**
 * Procedure를 구성하는 단일 단계.
 *
 * <p><strong>플래그:</strong></p>
 * <ul>
 *   <li>{@code singleTurn}: maxTurns=1로 실행</li>
 *   <li>{@code disallowAllTools}: 모든 도구 금지</li>
 *   <li>{@code suppressThoughtPosting}: thought/action 게시 생략 (response/error는 게시)</li>
 *   <li>{@code usesValidationLoop}: 결과를 검증 결과로 해석하여 fixer 루프 수행</li>
 * </ul>
 *
 * @param name 단계 이름 (예: "verifications")
 * @param promptPath 프롬프트 템플릿 경로 (null 가능)
 * @param description 설명 (전이 프롬프트 fallback에 사용)
 * @param singleTurn 단일 turn 여부
 * @param disallowAllTools 모든 도구 금지 여부
 * @param suppressThoughtPosting 진행 게시 억제 여부
 * @param usesValidationLoop 검증 루프 사용 여부
 * @param disallowedTools 추가 금지 도구
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Subroutine(
    String name,
    String promptPath,
    String description,
    boolean singleTurn,
    boolean disallowAllTools,
    boolean suppressThoughtPosting,
    boolean usesValidationLoop,
    List<String> disallowedTools
) {

    public Subroutine {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        description = description == null ? "" : description;
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
    }

    /**
     * 플래그 없는 일반 단계 생성.
     *
     * @param name 이름
     * @param promptPath 프롬프트 경로
     * @param description 설명
     * @return Subroutine
     */
    public static Subroutine of(String name, String promptPath, String description) {
        return new Subroutine(name, promptPath, description, false, false, false, false, List.of());
    }

    public Subroutine withSingleTurn(boolean singleTurn) {
        return new Subroutine(name, promptPath, description, singleTurn, disallowAllTools,
            suppressThoughtPosting, usesValidationLoop, disallowedTools);
    }

    public Subroutine withDisallowAllTools(boolean disallowAllTools) {
        return new Subroutine(name, promptPath, description, singleTurn, disallowAllTools,
            suppressThoughtPosting, usesValidationLoop, disallowedTools);
    }

    public Subroutine withSuppressThoughtPosting(boolean suppressThoughtPosting) {
        return new Subroutine(name, promptPath, description, singleTurn, disallowAllTools,
            suppressThoughtPosting, usesValidationLoop, disallowedTools);
    }

    public Subroutine withValidationLoop(boolean usesValidationLoop) {
        return new Subroutine(name, promptPath, description, singleTurn, disallowAllTools,
            suppressThoughtPosting, usesValidationLoop, disallowedTools);
    }

    public Subroutine withDisallowedTools(List<String> disallowedTools) {
        return new Subroutine(name, promptPath, description, singleTurn, disallowAllTools,
            suppressThoughtPosting, usesValidationLoop, disallowedTools);
    }
}
