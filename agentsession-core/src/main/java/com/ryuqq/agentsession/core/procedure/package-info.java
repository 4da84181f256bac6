/**
 * Procedure / Subroutine 모델.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.procedure;
