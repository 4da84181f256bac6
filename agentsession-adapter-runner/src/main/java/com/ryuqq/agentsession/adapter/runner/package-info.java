/**
 * 자식 프로세스 기반 RunnerAdapter 구현과 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.runner;
