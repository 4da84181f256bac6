package com.ryuqq.agentsession.adapter.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.agentsession.core.session.SessionEntry;
import com.ryuqq.agentsession.core.snapshot.PersistedState;
import com.ryuqq.agentsession.core.snapshot.SessionSnapshot;
import com.ryuqq.agentsession.core.snapshot.SnapshotPersistenceException;
import com.ryuqq.agentsession.core.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 단일 JSON 파일 기반 {@link SessionStore}.
 *
 * <p><strong>파일 형식:</strong></p>
 * <pre>
 * {
 *   "version": "3.0",
 *   "savedAt": "2024-05-01T12:00:00Z",
 *   "state": {
 *     "agentSessions": { repoId: { sessionId: {...} } },
 *     "agentSessionEntries": { repoId: { sessionId: [ {...} ] } },
 *     "childToParentAgentSession": { childId: parentId },
 *     "issueRepositoryCache": { workItemId: repoId }
 *   }
 * }
 * </pre>
 *
 * <p><strong>로드 규칙 (예외를 던지지 않음):</strong></p>
 * <ul>
 *   <li>파일 없음, 손상된 JSON, {@code state} 없음, 알 수 없는 버전 → empty</li>
 *   <li>v2.0 → v3.0으로 변환 후 즉시 v3.0으로 다시 저장</li>
 *   <li>읽을 수 없는 세션/기록 항목은 로그를 남기고 건너뜀</li>
 * </ul>
 *
 * <p><strong>저장:</strong> 임시 파일에 쓴 뒤 원자적으로 교체합니다. 디렉터리는 필요 시 생성합니다.
 * 쓰기 실패는 {@link SnapshotPersistenceException}으로 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);

    public static final String LEGACY_VERSION = "2.0";

    private static final TypeReference<List<SessionEntry>> ENTRY_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final FileSessionStoreConfig config;
    private final ObjectMapper mapper;

    public FileSessionStore(FileSessionStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.mapper = SnapshotJson.mapper();
    }

    public FileSessionStore() {
        this(new FileSessionStoreConfig());
    }

    // ========================================
    // 로드
    // ========================================

    @Override
    public Optional<PersistedState> load() {
        Path file = config.stateFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Invalid state file {} (not a JSON object), ignoring", file);
                return Optional.empty();
            }
            JsonNode state = root.get("state");
            if (state == null || !state.isObject()) {
                log.warn("Invalid state file {} (missing state), ignoring", file);
                return Optional.empty();
            }

            String version = root.path("version").asText(null);
            if (LEGACY_VERSION.equals(version)) {
                log.info("Migrating state from v{} to v{}", LEGACY_VERSION, CURRENT_VERSION);
                PersistedState migrated = toPersistedState(SnapshotMigrator.migrateV2ToV3((ObjectNode) state));
                persistMigrated(migrated);
                return Optional.of(migrated);
            }
            if (!CURRENT_VERSION.equals(version)) {
                log.warn("Unknown state file version {}, ignoring", version);
                return Optional.empty();
            }
            return Optional.of(toPersistedState(state));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load session state from {}", file, e);
            return Optional.empty();
        }
    }

    private void persistMigrated(PersistedState migrated) {
        try {
            save(migrated);
            log.info("Migration complete, saved as v{}", CURRENT_VERSION);
        } catch (SnapshotPersistenceException e) {
            log.error("Failed to persist migrated state, continuing with in-memory copy", e);
        }
    }

    private PersistedState toPersistedState(JsonNode state) {
        Map<String, Map<String, SessionSnapshot>> sessions = new LinkedHashMap<>();
        forEachField(state.get("agentSessions"), (repositoryId, repositorySessions) -> {
            Map<String, SessionSnapshot> parsed = new LinkedHashMap<>();
            forEachField(repositorySessions, (sessionId, node) -> {
                try {
                    if (node instanceof ObjectNode) {
                        SnapshotMigrator.normalizeSession((ObjectNode) node);
                    }
                    parsed.put(sessionId, mapper.treeToValue(node, SessionSnapshot.class));
                } catch (IOException | RuntimeException e) {
                    log.error("Skipping unreadable session {} in repository {}", sessionId, repositoryId, e);
                }
            });
            sessions.put(repositoryId, parsed);
        });

        Map<String, Map<String, List<SessionEntry>>> entries = new LinkedHashMap<>();
        forEachField(state.get("agentSessionEntries"), (repositoryId, repositoryEntries) -> {
            Map<String, List<SessionEntry>> parsed = new LinkedHashMap<>();
            forEachField(repositoryEntries, (sessionId, node) -> {
                try {
                    parsed.put(sessionId, mapper.readerFor(ENTRY_LIST).readValue(node));
                } catch (IOException | RuntimeException e) {
                    log.error("Skipping unreadable entries of session {} in repository {}", sessionId,
                        repositoryId, e);
                }
            });
            entries.put(repositoryId, parsed);
        });

        return new PersistedState(sessions, entries,
            stringMap(state.get("childToParentAgentSession")),
            stringMap(state.get("issueRepositoryCache")));
    }

    private Map<String, String> stringMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, STRING_MAP);
    }

    private static void forEachField(JsonNode node, FieldVisitor visitor) {
        if (node == null || !node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            visitor.visit(field.getKey(), field.getValue());
        }
    }

    @FunctionalInterface
    private interface FieldVisitor {
        void visit(String key, JsonNode value);
    }

    // ========================================
    // 저장
    // ========================================

    @Override
    public void save(PersistedState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        Path file = config.stateFile();
        Path temp = null;
        try {
            Files.createDirectories(config.stateDirectory());
            ObjectNode root = mapper.createObjectNode();
            root.put("version", CURRENT_VERSION);
            root.put("savedAt", Instant.now().toString());
            root.set("state", mapper.valueToTree(state));

            temp = Files.createTempFile(config.stateDirectory(), config.fileName(), ".tmp");
            mapper.writeValue(temp.toFile(), root);
            moveIntoPlace(temp, file);
            log.debug("Saved {} session(s) to {}", state.sessionCount(), file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new SnapshotPersistenceException("Failed to save session state to " + file, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary state file {}", temp, e);
        }
    }

    // ========================================
    // 파일 관리
    // ========================================

    public boolean hasStateFile() {
        return Files.exists(config.stateFile());
    }

    /**
     * 상태 파일 삭제.
     *
     * @return 삭제했으면 true
     */
    public boolean deleteStateFile() {
        try {
            return Files.deleteIfExists(config.stateFile());
        } catch (IOException e) {
            log.error("Failed to delete state file {}", config.stateFile(), e);
            return false;
        }
    }

    public Path stateFile() {
        return config.stateFile();
    }
}
