package com.ryuqq.agentsession.adapter.file;

import java.nio.file.Path;

/**
 * FileSessionStore 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>stateDirectory: {@code ~/.agentsession/state}</li>
 *   <li>fileName: {@code edge-worker-state.json}</li>
 * </ul>
 *
 * @param stateDirectory 상태 파일 디렉터리 (없으면 저장 시 생성)
 * @param fileName 상태 파일 이름
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FileSessionStoreConfig(Path stateDirectory, String fileName) {

    public static final String DEFAULT_FILE_NAME = "edge-worker-state.json";

    public FileSessionStoreConfig {
        if (stateDirectory == null) {
            throw new IllegalArgumentException("stateDirectory cannot be null");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be null or blank");
        }
        if (fileName.contains("/") || fileName.contains("\\")) {
            throw new IllegalArgumentException("fileName must not contain path separators (current: " + fileName + ")");
        }
    }

    public FileSessionStoreConfig() {
        this(Path.of(System.getProperty("user.home"), ".agentsession", "state"), DEFAULT_FILE_NAME);
    }

    public static FileSessionStoreConfig in(Path stateDirectory) {
        return new FileSessionStoreConfig(stateDirectory, DEFAULT_FILE_NAME);
    }

    public FileSessionStoreConfig withStateDirectory(Path stateDirectory) {
        return new FileSessionStoreConfig(stateDirectory, fileName);
    }

    public FileSessionStoreConfig withFileName(String fileName) {
        return new FileSessionStoreConfig(stateDirectory, fileName);
    }

    public Path stateFile() {
        return stateDirectory.resolve(fileName);
    }
}
