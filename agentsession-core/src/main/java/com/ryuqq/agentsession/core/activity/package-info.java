/**
 * 외부 진행 게시(activity) 모델.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.activity;
