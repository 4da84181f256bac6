/**
 * 기본 절차 목록과 분류 기반 절차 엔진.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.application.procedure;
