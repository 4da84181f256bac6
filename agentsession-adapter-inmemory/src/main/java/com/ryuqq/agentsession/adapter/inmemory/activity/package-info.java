/**
 * Recording ActivitySink.
 *
 * <p>Useful when the orchestrator runs without an issue tracker, and as a test double
 * that captures exactly what would have been posted.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.inmemory.activity;
