package com.ryuqq.agentsession.adapter.runner.support;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 작업 디렉터리 기준 경로 상대화.
 *
 * <p>작업 디렉터리 하위의 절대 경로만 상대 경로로 바꾸며, 그 외 경로는 그대로 통과시킵니다.</p>
 *
 * <pre>
 * workdir = /work/repo
 * /work/repo/pkg/a.ts  → pkg/a.ts
 * /work/repo           → /work/repo   (상대 경로가 비므로 유지)
 * /work/repo2/x.ts     → /work/repo2/x.ts
 * src/b.ts             → src/b.ts
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PathNormalizer {

    private static final Set<String> PATH_KEYS = Set.of("file_path", "path", "absolute_path", "dir_path", "notebook_path");

    private final Path workingDirectory;

    public PathNormalizer(Path workingDirectory) {
        this.workingDirectory = workingDirectory == null ? null : workingDirectory.toAbsolutePath().normalize();
    }

    /**
     * 경로 상대화.
     *
     * @param path 백엔드가 보고한 경로 (null 가능)
     * @return 상대화된 경로 또는 원본
     */
    public String normalize(String path) {
        if (path == null || path.isEmpty() || workingDirectory == null) {
            return path;
        }
        try {
            Path candidate = Path.of(path);
            if (!candidate.isAbsolute()) {
                return path;
            }
            Path normalized = candidate.normalize();
            if (!normalized.startsWith(workingDirectory)) {
                return path;
            }
            String relative = workingDirectory.relativize(normalized).toString();
            return relative.isEmpty() || ".".equals(relative) ? path : relative;
        } catch (InvalidPathException e) {
            return path;
        }
    }

    /**
     * 도구 입력의 경로 필드를 상대화한 복사본.
     *
     * @param input 도구 입력
     * @return 경로 키 값이 상대화된 새 Map
     */
    public Map<String, Object> normalizeInput(Map<String, Object> input) {
        Map<String, Object> result = new LinkedHashMap<>(input);
        for (String key : PATH_KEYS) {
            Object value = result.get(key);
            if (value instanceof String) {
                result.put(key, normalize((String) value));
            }
        }
        return result;
    }
}
