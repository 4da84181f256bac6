package com.ryuqq.agentsession.application.progress;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProgressFormatter 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProgressFormatterTest {

    private final ProgressFormatter formatter = new ProgressFormatter();

    // ========================================
    // 도구 파라미터
    // ========================================

    @Test
    void command가_있으면_command() {
        assertThat(formatter.formatToolParameter("Bash", Map.of("command", "ls -la"))).isEqualTo("ls -la");
    }

    @Test
    void 파일_경로와_줄_범위() {
        assertThat(formatter.formatToolParameter("Read", Map.of("file_path", "/src/App.java", "offset", 10, "limit", 20)))
            .isEqualTo("/src/App.java (lines 11-30)");
        assertThat(formatter.formatToolParameter("Read", Map.of("file_path", "/src/App.java", "offset", 5)))
            .isEqualTo("/src/App.java (lines 6-end)");
        assertThat(formatter.formatToolParameter("Read", Map.of("file_path", "/src/App.java")))
            .isEqualTo("/src/App.java");
    }

    @Test
    void pattern은_grep이_아니면_도구_이름을_덧붙인다() {
        assertThat(formatter.formatToolParameter("Grep", Map.of("pattern", "TODO"))).isEqualTo("TODO");
        assertThat(formatter.formatToolParameter("Glob", Map.of("pattern", "**/*.java")))
            .isEqualTo("**/*.java (Glob)");
    }

    @Test
    void 알_수_없는_입력은_JSON() {
        assertThat(formatter.formatToolParameter("Custom", Map.of("depth", 3))).isEqualTo("{\"depth\":3}");
        assertThat(formatter.formatToolParameter("Custom", Map.of())).isEmpty();
    }

    @Test
    void description이_있으면_액션_이름에_포함한다() {
        assertThat(formatter.formatToolActionName("Bash", Map.of("description", " List files "))).isEqualTo("Bash (List files)");
        assertThat(formatter.formatToolActionName("Bash", Map.of())).isEqualTo("Bash");
    }

    // ========================================
    // 결과 / 할 일 목록
    // ========================================

    @Test
    void 도구_결과_포맷() {
        assertThat(formatter.formatToolResult("", false)).isEqualTo("No output");
        assertThat(formatter.formatToolResult("exit 1", true)).isEqualTo("```\nexit 1\n```");
    }

    @Test
    void 할_일_목록을_체크리스트로_변환한다() {
        // given
        Map<String, Object> input = Map.of("todos", List.of(
            Map.of("content", "Write test", "status", "completed"),
            Map.of("content", "Fix bug", "status", "in_progress"),
            Map.of("content", "Open PR", "status", "pending")));

        // when
        String formatted = formatter.formatTodoList(input);

        // then
        assertThat(formatted).isEqualTo("- [x] Write test\n- [ ] Fix bug (in progress)\n- [ ] Open PR");
    }

    @Test
    void 최대_길이를_넘으면_잘라낸다() {
        // given
        ProgressFormatter shortFormatter = new ProgressFormatter(5);

        // when & then
        assertThat(shortFormatter.truncate("abcdefgh")).isEqualTo("abcde\n\n[truncated]");
        assertThat(shortFormatter.truncate("abc")).isEqualTo("abc");
        assertThatThrownBy(() -> new ProgressFormatter(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
