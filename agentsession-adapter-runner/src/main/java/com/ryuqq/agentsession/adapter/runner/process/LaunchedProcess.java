package com.ryuqq.agentsession.adapter.runner.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * 실행 중인 백엔드 프로세스 handle.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LaunchedProcess {

    InputStream stdout();

    InputStream stderr();

    OutputStream stdin();

    /**
     * 종료 대기.
     *
     * @return 종료 코드
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    int waitFor() throws InterruptedException;

    /**
     * 종료 신호 전송 (협조적 취소, 즉시 종료를 보장하지 않음).
     */
    void destroy();

    boolean isAlive();

    /**
     * stdin 닫기 (idempotent).
     *
     * @throws IOException 닫기에 실패한 경우
     */
    default void closeStdin() throws IOException {
        stdin().close();
    }
}
