/**
 * 애플리케이션 계층 테스트용 가짜 runner.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.testkit.fake;
