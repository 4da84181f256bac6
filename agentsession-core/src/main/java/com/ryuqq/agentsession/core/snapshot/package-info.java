/**
 * 영속화 스냅샷 모델.
 *
 * <p>직렬화 라이브러리에 의존하지 않는 순수 record로 정의되며, 저장 형식은 adapter가 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.snapshot;
