/**
 * Claude Code CLI runner (스트리밍 입력 지원).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.runner.claude;
