package com.ryuqq.agentsession.adapter.file;

import com.ryuqq.agentsession.testkit.contract.AbstractSessionStoreContractTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Contract Tests for FileSessionStore.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FileSessionStoreContractTest extends AbstractSessionStoreContractTest {

    @TempDir
    Path stateDirectory;

    @BeforeEach
    void setUp() {
        this.store = new FileSessionStore(FileSessionStoreConfig.in(stateDirectory.resolve("state")));
    }
}
