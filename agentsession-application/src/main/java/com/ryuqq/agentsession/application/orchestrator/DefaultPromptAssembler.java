package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.core.procedure.Subroutine;
import com.ryuqq.agentsession.core.session.Session;

import java.util.Optional;
import java.util.function.Function;

/**
 * 기본 프롬프트 조립기.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>단계 지시문: promptLoader가 돌려준 단계 프롬프트, 없으면 {@code Continue with: <description>}</li>
 *   <li>SESSION_START / USER_PROMPT: 본문 뒤에 단계 지시문</li>
 *   <li>SUBROUTINE_TRANSITION / VALIDATION_RERUN: 단계 지시문만</li>
 *   <li>CHILD_RESULT / VALIDATION_FIXER: 본문만 (이미 완성된 프롬프트)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultPromptAssembler implements PromptAssembler {

    private final Function<Subroutine, Optional<String>> promptLoader;

    public DefaultPromptAssembler() {
        this(subroutine -> Optional.empty());
    }

    /**
     * @param promptLoader 단계별 프롬프트 로더 (promptPath 해석은 호출자 책임)
     */
    public DefaultPromptAssembler(Function<Subroutine, Optional<String>> promptLoader) {
        if (promptLoader == null) {
            throw new IllegalArgumentException("promptLoader cannot be null");
        }
        this.promptLoader = promptLoader;
    }

    @Override
    public String assemble(EventKind kind, Session session, Subroutine subroutine, String eventText) {
        String text = eventText == null ? "" : eventText.trim();
        switch (kind) {
            case CHILD_RESULT:
            case VALIDATION_FIXER:
                return text;
            case SUBROUTINE_TRANSITION:
            case VALIDATION_RERUN:
                return subroutine == null ? text : instructionFor(subroutine);
            default:
                if (subroutine == null) {
                    return text;
                }
                String instruction = instructionFor(subroutine);
                return text.isEmpty() ? instruction : text + "\n\n" + instruction;
        }
    }

    private String instructionFor(Subroutine subroutine) {
        return promptLoader.apply(subroutine)
            .filter(prompt -> !prompt.isBlank())
            .orElseGet(() -> "Continue with: "
                + (subroutine.description().isBlank() ? subroutine.name() : subroutine.description()));
    }
}
