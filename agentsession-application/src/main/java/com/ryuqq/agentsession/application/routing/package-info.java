/**
 * 라벨 / 설명 태그 기반 백엔드, 모델, 도구 preset 결정.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.application.routing;
