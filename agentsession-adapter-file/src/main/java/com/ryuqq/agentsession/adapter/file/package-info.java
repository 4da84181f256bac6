/**
 * JSON 파일 기반 SessionStore와 스냅샷 버전 마이그레이션.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentsession.adapter.file.FileSessionStore} - 원자적 저장, 예외 없는 로드</li>
 *   <li>{@link com.ryuqq.agentsession.adapter.file.SnapshotMigrator} - v2.0 → v3.0 변환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.file;
