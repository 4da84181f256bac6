package com.ryuqq.agentsession.adapter.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.agentsession.core.session.EntryType;
import com.ryuqq.agentsession.core.session.SessionEntry;
import com.ryuqq.agentsession.core.snapshot.PersistedState;
import com.ryuqq.agentsession.core.snapshot.SessionSnapshot;
import com.ryuqq.agentsession.core.snapshot.SnapshotPersistenceException;
import com.ryuqq.agentsession.testkit.contract.SnapshotFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSessionStoreTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path stateDirectory;
    private FileSessionStore store;

    @BeforeEach
    void setUp() {
        stateDirectory = tempDir.resolve("nested").resolve("state");
        store = new FileSessionStore(FileSessionStoreConfig.in(stateDirectory));
    }

    private void writeStateFile(String json) throws IOException {
        Files.createDirectories(stateDirectory);
        Files.writeString(stateDirectory.resolve(FileSessionStoreConfig.DEFAULT_FILE_NAME), json,
            StandardCharsets.UTF_8);
    }

    private String fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ========================================
    // 저장
    // ========================================

    @Test
    void 디렉터리를_만들고_현재_버전으로_저장한다() throws IOException {
        // when
        store.save(SnapshotFixtures.state());

        // then
        Path file = stateDirectory.resolve("edge-worker-state.json");
        assertThat(file).exists();
        JsonNode root = JSON.readTree(file.toFile());
        assertThat(root.get("version").asText()).isEqualTo("3.0");
        assertThat(root.get("savedAt").asText()).isNotBlank();
        assertThat(root.at("/state/agentSessions/repo-1/session-1/claudeSessionId").asText())
            .isEqualTo("claude-session-1");
        assertThat(root.at("/state/issueRepositoryCache/issue-1").asText()).isEqualTo("repo-1");
    }

    @Test
    void 임시_파일을_남기지_않는다() throws IOException {
        // when
        store.save(SnapshotFixtures.state());
        store.save(PersistedState.empty());

        // then
        try (Stream<Path> files = Files.list(stateDirectory)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                .containsExactly("edge-worker-state.json");
        }
    }

    @Test
    void 파생_필드는_기록에_쓰지_않는다() throws IOException {
        // when
        store.save(SnapshotFixtures.state());

        // then
        JsonNode entry = JSON.readTree(store.stateFile().toFile())
            .at("/state/agentSessionEntries/repo-1/session-1/1");
        assertThat(entry.has("toolUse")).isFalse();
        assertThat(entry.get("type").asText()).isEqualTo("ASSISTANT");
    }

    @Test
    void 쓸_수_없는_위치면_예외로_알린다() throws IOException {
        // given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        FileSessionStore blocked = new FileSessionStore(FileSessionStoreConfig.in(blocker.resolve("state")));

        // when & then
        assertThatThrownBy(() -> blocked.save(PersistedState.empty()))
            .isInstanceOf(SnapshotPersistenceException.class)
            .hasMessageContaining("Failed to save session state");
    }

    // ========================================
    // 로드
    // ========================================

    @Test
    void 파일이_없으면_비어_있다() {
        assertThat(store.load()).isEmpty();
        assertThat(store.hasStateFile()).isFalse();
    }

    @Test
    void 손상된_JSON은_예외_없이_비어_있다() throws IOException {
        // given
        writeStateFile("{ this is not json");

        // when & then
        assertThat(store.load()).isEmpty();
    }

    @Test
    void state가_없으면_비어_있다() throws IOException {
        // given
        writeStateFile("{\"version\": \"3.0\", \"savedAt\": \"2024-01-01T00:00:00Z\"}");

        // when & then
        assertThat(store.load()).isEmpty();
    }

    @Test
    void 알_수_없는_버전은_비어_있고_파일을_건드리지_않는다() throws IOException {
        // given
        String original = "{\"version\": \"1.0\", \"state\": {\"agentSessions\": {}}}";
        writeStateFile(original);

        // when
        Optional<PersistedState> loaded = store.load();

        // then
        assertThat(loaded).isEmpty();
        assertThat(Files.readString(store.stateFile())).isEqualTo(original);
    }

    @Test
    void 읽을_수_없는_세션만_건너뛴다() throws IOException {
        // given
        writeStateFile("{\"version\": \"3.0\", \"state\": {\"agentSessions\": {\"repo-1\": {"
            + "\"good\": {\"id\": \"good\", \"issueId\": \"issue-1\", \"status\": \"idle\","
            + " \"workspace\": {\"path\": \"/work\", \"gitWorktree\": false}},"
            + "\"bad\": {\"id\": \"bad\", \"issueContext\": {\"issueId\": \"issue-2\"}}"
            + "}}}}");

        // when
        PersistedState loaded = store.load().orElseThrow();

        // then
        assertThat(loaded.agentSessions().get("repo-1")).containsOnlyKeys("good");
    }

    @Test
    void 이전_형식의_isGitWorktree를_읽는다() throws IOException {
        // given
        writeStateFile("{\"version\": \"3.0\", \"state\": {\"agentSessions\": {\"repo-1\": {"
            + "\"s-1\": {\"id\": \"s-1\", \"issueId\": \"issue-1\","
            + " \"workspace\": {\"path\": \"/work/s-1\", \"isGitWorktree\": true}}}}}}");

        // when
        SessionSnapshot snapshot = store.load().orElseThrow().agentSessions().get("repo-1").get("s-1");

        // then
        assertThat(snapshot.workspace().path()).isEqualTo("/work/s-1");
        assertThat(snapshot.workspace().gitWorktree()).isTrue();
    }

    // ========================================
    // v2 마이그레이션
    // ========================================

    @Test
    void v2_세션에_id_externalSessionId_issueContext를_추가한다() throws IOException {
        // given
        writeStateFile(fixture("state-v2.json"));

        // when
        PersistedState loaded = store.load().orElseThrow();

        // then
        SessionSnapshot first = loaded.agentSessions().get("repo-1").get("lin-session-1");
        assertThat(first.id()).isEqualTo("lin-session-1");
        assertThat(first.externalSessionId()).isEqualTo("lin-session-1");
        assertThat(first.issueContext().trackerId()).isEqualTo("linear");
        assertThat(first.issueContext().issueId()).isEqualTo("issue-1");
        assertThat(first.issueContext().issueIdentifier()).isEqualTo("ENG-42");
        assertThat(first.issueId()).isEqualTo("issue-1");
        assertThat(first.issue().identifier()).isEqualTo("ENG-42");
        assertThat(first.claudeSessionId()).isEqualTo("claude-abc");
        assertThat(first.workspace().gitWorktree()).isTrue();

        SessionSnapshot second = loaded.agentSessions().get("repo-1").get("lin-session-2");
        assertThat(second.issueContext().issueIdentifier()).isEqualTo("issue-2");
        assertThat(second.codexSessionId()).isEqualTo("thread-77");
    }

    @Test
    void 기록과_매핑은_그대로_유지한다() throws IOException {
        // given
        writeStateFile(fixture("state-v2.json"));

        // when
        PersistedState loaded = store.load().orElseThrow();

        // then
        List<SessionEntry> entries = loaded.agentSessionEntries().get("repo-1").get("lin-session-1");
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).type()).isEqualTo(EntryType.ASSISTANT);
        assertThat(entries.get(0).content()).isEqualTo("I'll look at the redirect handler.");
        assertThat(loaded.childToParentAgentSession()).isEqualTo(Map.of("lin-session-2", "lin-session-1"));
        assertThat(loaded.issueRepositoryCache()).isEqualTo(Map.of("issue-1", "repo-1", "issue-2", "repo-1"));
    }

    @Test
    void 마이그레이션_결과를_즉시_현재_버전으로_다시_저장한다() throws IOException {
        // given
        writeStateFile(fixture("state-v2.json"));

        // when
        store.load();

        // then
        JsonNode root = JSON.readTree(store.stateFile().toFile());
        assertThat(root.get("version").asText()).isEqualTo("3.0");
        assertThat(root.at("/state/agentSessions/repo-1/lin-session-1/issueContext/trackerId").asText())
            .isEqualTo("linear");

        PersistedState reloaded = store.load().orElseThrow();
        assertThat(reloaded.sessionCount()).isEqualTo(2);
    }

    @Test
    void 상태_파일을_삭제한다() {
        // given
        store.save(SnapshotFixtures.state());

        // when
        boolean deleted = store.deleteStateFile();

        // then
        assertThat(deleted).isTrue();
        assertThat(store.hasStateFile()).isFalse();
        assertThat(store.load()).isEmpty();
    }
}
