/**
 * 백엔드 CLI 프로세스 추상화.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.runner.process;
