/**
 * In-memory SessionStore for tests and embedding.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.inmemory.store;
