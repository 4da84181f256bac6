/**
 * Session 엔티티와 관련 값 객체.
 *
 * <p><strong>핵심 타입:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.agentsession.core.session.Session}: 작업 단위별 가변 엔티티</li>
 *   <li>{@link com.ryuqq.agentsession.core.session.SessionEntry}: 영속 가능한 메시지 기록</li>
 *   <li>{@link com.ryuqq.agentsession.core.session.ResumeHandle}: 백엔드별 resume 정보</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.session;
