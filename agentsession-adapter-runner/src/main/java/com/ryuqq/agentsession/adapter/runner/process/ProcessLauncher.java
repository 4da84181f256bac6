package com.ryuqq.agentsession.adapter.runner.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 백엔드 CLI 프로세스 기동.
 *
 * <p>테스트에서는 스크립트된 출력을 돌려주는 구현으로 교체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * 프로세스 기동.
     *
     * @param command 실행 파일과 인자
     * @param workingDirectory 작업 디렉터리
     * @param environment 추가 환경 변수
     * @return 실행 중인 프로세스
     * @throws IOException 실행 파일이 없거나 기동에 실패한 경우
     */
    LaunchedProcess launch(List<String> command, Path workingDirectory, Map<String, String> environment)
        throws IOException;
}
