/**
 * cursor-agent runner (버전 확인, tool_call 투영).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.runner.cursor;
