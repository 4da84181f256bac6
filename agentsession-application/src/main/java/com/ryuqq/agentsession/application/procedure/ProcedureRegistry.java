package com.ryuqq.agentsession.application.procedure;

import com.ryuqq.agentsession.core.procedure.Procedure;
import com.ryuqq.agentsession.core.procedure.Subroutine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 이름으로 조회 가능한 절차 목록과 분류 → 절차 매핑.
 *
 * <p><strong>기본 분류 매핑:</strong></p>
 * <pre>
 * question      → simple-question
 * documentation → documentation-edit
 * transient     → simple-question
 * planning      → plan-mode
 * code          → full-development
 * debugger      → debugger-full
 * orchestrator  → orchestrator-full
 * user-testing  → user-testing
 * release       → release
 * </pre>
 *
 * <p>요약 계열 단계는 단일 턴, 도구 없음, 중간 진행 게시 억제로 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProcedureRegistry {

    public static final String DEFAULT_CLASSIFICATION = "code";
    public static final String DEFAULT_PROCEDURE = "full-development";

    // ========================================
    // 단계 정의
    // ========================================

    public static final Subroutine PRIMARY = Subroutine.of("primary", "primary",
        "Main work execution");
    public static final Subroutine CODING_ACTIVITY = Subroutine.of("coding-activity",
        "subroutines/coding-activity.md", "Implementation phase for code changes");
    public static final Subroutine DEBUGGER_REPRODUCTION = Subroutine.of("debugger-reproduction",
        "subroutines/debugger-reproduction.md", "Reproduce the reported bug with a failing test");
    public static final Subroutine DEBUGGER_FIX = Subroutine.of("debugger-fix",
        "subroutines/debugger-fix.md", "Fix the root cause of the reproduced bug");
    public static final Subroutine VERIFICATIONS = Subroutine.of("verifications",
        "subroutines/verifications.md", "Run tests, linting and type checks")
        .withValidationLoop(true);
    public static final Subroutine VALIDATION_FIXER = Subroutine.of("validation-fixer",
        "subroutines/validation-fixer.md", "Fix failures reported by the verifications step");
    public static final Subroutine CHANGELOG_UPDATE = Subroutine.of("changelog-update",
        "subroutines/changelog-update.md", "Update the changelog for the change");
    public static final Subroutine GIT_COMMIT = Subroutine.of("git-commit",
        "subroutines/git-commit.md", "Commit the changes");
    public static final Subroutine GH_PR = Subroutine.of("gh-pr",
        "subroutines/gh-pr.md", "Create or update the pull request");
    public static final Subroutine CONCISE_SUMMARY = summary("concise-summary",
        "Brief summary of the completed work");
    public static final Subroutine VERBOSE_SUMMARY = summary("verbose-summary",
        "Detailed summary of the completed work");
    public static final Subroutine QUESTION_INVESTIGATION = Subroutine.of("question-investigation",
        "subroutines/question-investigation.md", "Gather the information needed to answer");
    public static final Subroutine QUESTION_ANSWER = summary("question-answer",
        "Answer the question directly");
    public static final Subroutine PREPARATION = Subroutine.of("preparation",
        "subroutines/preparation.md", "Check whether the request has enough detail to act on");
    public static final Subroutine PLAN_SUMMARY = summary("plan-summary",
        "Present the clarifying questions or the implementation plan");
    public static final Subroutine USER_TESTING = Subroutine.of("user-testing",
        "subroutines/user-testing.md", "Run the tests the user asked for");
    public static final Subroutine USER_TESTING_SUMMARY = summary("user-testing-summary",
        "Summarize the testing session");
    public static final Subroutine RELEASE_EXECUTION = Subroutine.of("release-execution",
        "subroutines/release-execution.md", "Execute the release steps");
    public static final Subroutine RELEASE_SUMMARY = summary("release-summary",
        "Summarize the release");
    public static final Subroutine FULL_DELEGATION = Subroutine.of("full-delegation",
        "subroutines/full-delegation.md", "Carry out the whole request in one session");

    private final Map<String, Procedure> procedures;
    private final Map<String, String> classificationToProcedure;

    /**
     * 절차와 분류 매핑으로 생성.
     *
     * @param procedures 등록할 절차 목록
     * @param classificationToProcedure 분류 → 절차 이름
     * @throws IllegalArgumentException 매핑이 등록되지 않은 절차를 가리키는 경우
     */
    public ProcedureRegistry(List<Procedure> procedures, Map<String, String> classificationToProcedure) {
        if (procedures == null || procedures.isEmpty()) {
            throw new IllegalArgumentException("procedures cannot be null or empty");
        }
        if (classificationToProcedure == null) {
            throw new IllegalArgumentException("classificationToProcedure cannot be null");
        }
        Map<String, Procedure> byName = new LinkedHashMap<>();
        for (Procedure procedure : procedures) {
            byName.put(procedure.name(), procedure);
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        classificationToProcedure.forEach((classification, procedureName) -> {
            if (!byName.containsKey(procedureName)) {
                throw new IllegalArgumentException(
                    "Unknown procedure for classification " + classification + ": " + procedureName);
            }
            mapping.put(classification.toLowerCase(Locale.ROOT), procedureName);
        });
        this.procedures = Collections.unmodifiableMap(byName);
        this.classificationToProcedure = Collections.unmodifiableMap(mapping);
    }

    /**
     * 기본 절차 목록.
     *
     * @return 기본 레지스트리
     */
    public static ProcedureRegistry defaults() {
        List<Procedure> procedures = List.of(
            new Procedure("simple-question", "Answer a question without code changes",
                List.of(QUESTION_INVESTIGATION, QUESTION_ANSWER)),
            new Procedure("documentation-edit", "Documentation-only change",
                List.of(PRIMARY, GIT_COMMIT, GH_PR, CONCISE_SUMMARY)),
            new Procedure("full-development", "Code change with verification and pull request",
                List.of(CODING_ACTIVITY, VERIFICATIONS, CHANGELOG_UPDATE, GIT_COMMIT, GH_PR, CONCISE_SUMMARY)),
            new Procedure("debugger-full", "Reproduce, fix and verify a bug",
                List.of(DEBUGGER_REPRODUCTION, DEBUGGER_FIX, VERIFICATIONS, CHANGELOG_UPDATE, GIT_COMMIT,
                    GH_PR, CONCISE_SUMMARY)),
            new Procedure("orchestrator-full", "Coordinate child sessions",
                List.of(PRIMARY, CONCISE_SUMMARY)),
            new Procedure("plan-mode", "Clarify requirements or write a plan",
                List.of(PREPARATION, PLAN_SUMMARY)),
            new Procedure("user-testing", "Run user-requested testing",
                List.of(USER_TESTING, USER_TESTING_SUMMARY)),
            new Procedure("release", "Execute a release",
                List.of(RELEASE_EXECUTION, RELEASE_SUMMARY)),
            new Procedure("full-delegation", "Single-session delegation",
                List.of(FULL_DELEGATION))
        );
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("question", "simple-question");
        mapping.put("documentation", "documentation-edit");
        mapping.put("transient", "simple-question");
        mapping.put("planning", "plan-mode");
        mapping.put("code", "full-development");
        mapping.put("debugger", "debugger-full");
        mapping.put("orchestrator", "orchestrator-full");
        mapping.put("user-testing", "user-testing");
        mapping.put("release", "release");
        return new ProcedureRegistry(procedures, mapping);
    }

    public Optional<Procedure> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(procedures.get(name));
    }

    /**
     * 분류에 해당하는 절차 이름.
     *
     * @param classification 분류 (대소문자 무시)
     * @return 매핑이 없으면 empty
     */
    public Optional<String> procedureNameFor(String classification) {
        if (classification == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(classificationToProcedure.get(classification.toLowerCase(Locale.ROOT)));
    }

    public List<Procedure> all() {
        return List.copyOf(procedures.values());
    }

    private static Subroutine summary(String name, String description) {
        return Subroutine.of(name, "subroutines/" + name + ".md", description)
            .withSingleTurn(true)
            .withDisallowAllTools(true)
            .withSuppressThoughtPosting(true);
    }
}
