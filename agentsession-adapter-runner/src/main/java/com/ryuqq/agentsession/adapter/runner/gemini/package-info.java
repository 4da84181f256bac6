/**
 * Gemini CLI runner (delta 메시지 누적).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.runner.gemini;
