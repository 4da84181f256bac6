package com.ryuqq.agentsession.adapter.inmemory.store;

import com.ryuqq.agentsession.testkit.contract.AbstractSessionStoreContractTest;
import org.junit.jupiter.api.BeforeEach;

/**
 * Contract Tests for InMemorySessionStore.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemorySessionStoreContractTest extends AbstractSessionStoreContractTest {

    @BeforeEach
    void setUp() {
        this.store = new InMemorySessionStore();
    }
}
