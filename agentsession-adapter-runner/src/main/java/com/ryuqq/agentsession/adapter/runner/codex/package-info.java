/**
 * Codex CLI runner와 item 투영.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.runner.codex;
