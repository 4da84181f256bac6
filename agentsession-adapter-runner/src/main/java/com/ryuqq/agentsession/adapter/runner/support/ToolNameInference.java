package com.ryuqq.agentsession.adapter.runner.support;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 명령 문자열로부터 백엔드 독립 도구 이름 추론.
 *
 * <p><strong>규칙 (위에서부터 순서대로):</strong></p>
 * <ol>
 *   <li>{@code rg} / {@code grep} → Grep</li>
 *   <li>{@code glob.glob} 또는 {@code find ... -name} → Glob</li>
 *   <li>리다이렉션 없는 {@code cat} → Read</li>
 *   <li>heredoc 리다이렉션 또는 {@code echo ... >} → Write</li>
 *   <li>그 외 → Bash</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ToolNameInference {

    private static final Pattern GREP = Pattern.compile("\\brg\\b|\\bgrep\\b");
    private static final Pattern GLOB = Pattern.compile("\\bglob\\.glob\\b|\\bfind\\b.+\\s-name\\s");
    private static final Pattern CAT = Pattern.compile("\\bcat\\b");
    private static final Pattern HEREDOC_WRITE = Pattern.compile("<<\\s*['\"]?eof['\"]?\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ECHO_WRITE = Pattern.compile("\\becho\\b.+>");

    // Utility class - prevent instantiation
    private ToolNameInference() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 도구 이름 추론.
     *
     * @param command 명령 문자열 (null 가능)
     * @return Grep, Glob, Read, Write, Bash 중 하나
     */
    public static String fromCommand(String command) {
        if (command == null || command.isBlank()) {
            return "Bash";
        }
        String normalized = command.toLowerCase(Locale.ROOT);
        if (GREP.matcher(normalized).find()) {
            return "Grep";
        }
        if (GLOB.matcher(normalized).find()) {
            return "Glob";
        }
        if (CAT.matcher(normalized).find() && !normalized.contains(">")) {
            return "Read";
        }
        if (HEREDOC_WRITE.matcher(command).find() || ECHO_WRITE.matcher(normalized).find()) {
            return "Write";
        }
        return "Bash";
    }
}
