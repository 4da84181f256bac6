package com.ryuqq.agentsession.adapter.runner.support;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ToolNameInference 유닛 테스트.
 */
class ToolNameInferenceTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
        "rg -n TODO src                         | Grep",
        "git grep foo                           | Grep",
        "python -c 'import glob; glob.glob(\"*\")' | Glob",
        "find . -type f -name '*.java'          | Glob",
        "cat README.md                          | Read",
        "cat a.txt > b.txt                      | Bash",
        "echo hello > out.txt                   | Write",
        "cat <<'EOF' > notes.md                 | Write",
        "npm test                               | Bash"
    })
    void 명령으로부터_도구_이름_추론(String command, String expected) {
        assertThat(ToolNameInference.fromCommand(command)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void 빈_명령은_Bash(String command) {
        assertThat(ToolNameInference.fromCommand(command)).isEqualTo("Bash");
    }
}
