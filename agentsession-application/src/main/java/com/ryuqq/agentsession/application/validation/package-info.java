/**
 * 검증 루프: 검증 결과 파싱과 fixer 프롬프트.
 *
 * <p>검증 단계는 마지막에 {@code {"pass": true|false, "reason": "..."}} 형태의 JSON을 출력해야 합니다.
 * 파싱할 수 없는 출력은 실패로 간주합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.application.validation;
