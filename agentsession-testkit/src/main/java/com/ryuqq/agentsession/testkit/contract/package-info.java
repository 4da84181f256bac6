/**
 * RunnerAdapter / SessionStore 구현이 공통으로 지켜야 하는 계약 테스트 기반.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.testkit.contract;
