package com.ryuqq.agentsession.adapter.inmemory.store;

import com.ryuqq.agentsession.core.snapshot.PersistedState;
import com.ryuqq.agentsession.core.spi.SessionStore;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link SessionStore} for tests and embedding.
 *
 * <p>Holds only the most recently saved snapshot. {@link PersistedState} is immutable,
 * so the stored reference can be handed out as-is.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No version migration (snapshots never leave the process)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySessionStore implements SessionStore {

    private final AtomicReference<PersistedState> current = new AtomicReference<>();
    private final AtomicInteger saveCount = new AtomicInteger();

    public InMemorySessionStore() {
    }

    /**
     * Creates a store pre-populated with a snapshot.
     *
     * @param initial snapshot returned by the first {@link #load()}
     */
    public InMemorySessionStore(PersistedState initial) {
        current.set(initial);
    }

    @Override
    public Optional<PersistedState> load() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void save(PersistedState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        current.set(state);
        saveCount.incrementAndGet();
    }

    /**
     * Number of {@link #save} calls since creation.
     *
     * @return save count
     */
    public int saveCount() {
        return saveCount.get();
    }

    public void clear() {
        current.set(null);
    }
}
