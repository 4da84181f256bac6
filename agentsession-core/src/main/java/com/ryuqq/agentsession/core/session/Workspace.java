package com.ryuqq.agentsession.core.session;

/**
 * 세션 작업 디렉터리.
 *
 * @param path 절대 경로
 * @param gitWorktree git worktree 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Workspace(String path, boolean gitWorktree) {

    public Workspace {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
    }

    public static Workspace of(String path) {
        return new Workspace(path, false);
    }
}
