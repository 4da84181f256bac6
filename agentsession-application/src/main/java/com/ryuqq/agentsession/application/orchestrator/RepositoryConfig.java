package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.application.routing.ToolPolicy;

import java.nio.file.Path;
import java.util.List;

/**
 * 세션이 작업하는 저장소 설정.
 *
 * <p>allowedTools가 비어 있으면 {@link ToolPolicy#SAFE}를 사용합니다.
 * 도구 목록에는 preset 이름({@code readOnly}, {@code safe}, {@code all}, {@code coordinator})을 섞어 쓸 수 있습니다.</p>
 *
 * @param id 저장소 ID
 * @param name 표시 이름
 * @param repositoryPath 저장소 경로 (워크스페이스가 없을 때 작업 디렉터리)
 * @param allowedTools 허용 도구
 * @param disallowedTools 금지 도구
 * @param extraDirectories 추가로 열어 줄 디렉터리
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RepositoryConfig(
    String id,
    String name,
    Path repositoryPath,
    List<String> allowedTools,
    List<String> disallowedTools,
    List<Path> extraDirectories
) {

    public RepositoryConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (repositoryPath == null) {
            throw new IllegalArgumentException("repositoryPath cannot be null");
        }
        name = name == null || name.isBlank() ? id : name;
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
        extraDirectories = extraDirectories == null ? List.of() : List.copyOf(extraDirectories);
    }

    public static RepositoryConfig of(String id, Path repositoryPath) {
        return new RepositoryConfig(id, id, repositoryPath, List.of(), List.of(), List.of());
    }

    public RepositoryConfig withAllowedTools(List<String> allowedTools) {
        return new RepositoryConfig(id, name, repositoryPath, allowedTools, disallowedTools, extraDirectories);
    }

    public RepositoryConfig withDisallowedTools(List<String> disallowedTools) {
        return new RepositoryConfig(id, name, repositoryPath, allowedTools, disallowedTools, extraDirectories);
    }

    public RepositoryConfig withExtraDirectories(List<Path> extraDirectories) {
        return new RepositoryConfig(id, name, repositoryPath, allowedTools, disallowedTools, extraDirectories);
    }

    /**
     * preset을 펼친 허용 도구 목록.
     *
     * @return 허용 도구 (설정이 비어 있으면 safe preset)
     */
    public List<String> resolvedAllowedTools() {
        return allowedTools.isEmpty() ? ToolPolicy.SAFE : ToolPolicy.resolve(allowedTools);
    }

    public List<String> resolvedDisallowedTools() {
        return ToolPolicy.resolve(disallowedTools);
    }
}
