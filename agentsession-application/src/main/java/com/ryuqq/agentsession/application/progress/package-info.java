/**
 * 진행 상황 게시용 텍스트 포맷.
 */
package com.ryuqq.agentsession.application.progress;
