package com.ryuqq.agentsession.testkit.fake;

import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.spi.RunnerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link FakeRunnerAdapter}를 만들고 기록하는 RunnerFactory.
 *
 * <p>Claude만 스트리밍 입력을 지원하는 실제 백엔드 특성을 따릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeRunnerFactory implements RunnerFactory {

    private final List<FakeRunnerAdapter> created = new ArrayList<>();
    private RuntimeException nextStartFailure;

    @Override
    public synchronized RunnerAdapter create(BackendType backend, RunnerConfig config) {
        FakeRunnerAdapter runner = new FakeRunnerAdapter(backend, config, backend == BackendType.CLAUDE);
        if (nextStartFailure != null) {
            runner.failOnStart(nextStartFailure);
            nextStartFailure = null;
        }
        created.add(runner);
        return runner;
    }

    /**
     * 다음에 생성되는 runner의 start를 실패시킴.
     *
     * @param failure 던질 예외
     */
    public synchronized void failNextStart(RuntimeException failure) {
        this.nextStartFailure = failure;
    }

    public synchronized List<FakeRunnerAdapter> created() {
        return List.copyOf(created);
    }

    /**
     * 마지막으로 생성된 runner.
     *
     * @return runner
     * @throws IllegalStateException 생성된 runner가 없는 경우
     */
    public synchronized FakeRunnerAdapter lastCreated() {
        if (created.isEmpty()) {
            throw new IllegalStateException("No runner has been created");
        }
        return created.get(created.size() - 1);
    }
}
