package com.ryuqq.agentsession.adapter.inmemory.activity;

import com.ryuqq.agentsession.core.activity.ActivityContent;
import com.ryuqq.agentsession.core.activity.ActivityPostOptions;
import com.ryuqq.agentsession.core.activity.ActivityPostResult;
import com.ryuqq.agentsession.core.activity.ActivityType;
import com.ryuqq.agentsession.core.spi.ActivitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ActivitySink} that records every post.
 *
 * <p>Issues sequential ids ({@code agent-session-1}, {@code activity-1}, ...) and keeps
 * posts in arrival order. Tests can make the next call fail to exercise
 * the "posting failures are logged, never thrown" path.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryActivitySink sink = new InMemoryActivitySink();
 * SessionManager manager = new SessionManager(sink, procedureEngine);
 * ...
 * assertThat(sink.bodiesOf(ActivityType.RESPONSE)).containsExactly("Done");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryActivitySink implements ActivitySink {

    /**
     * A recorded post.
     *
     * @param sessionId external session id
     * @param content content
     * @param options options
     * @param activityId issued activity id
     */
    public record PostedActivity(String sessionId, ActivityContent content, ActivityPostOptions options,
                                 String activityId) {
    }

    private final List<PostedActivity> posted = new ArrayList<>();
    private final List<String> createdSessions = new ArrayList<>();
    private final AtomicInteger sessionSequence = new AtomicInteger();
    private final AtomicInteger activitySequence = new AtomicInteger();

    private RuntimeException nextPostFailure;
    private RuntimeException nextCreateFailure;

    @Override
    public ActivityPostResult postActivity(String externalSessionId, ActivityContent content,
                                           ActivityPostOptions options) {
        synchronized (this) {
            if (nextPostFailure != null) {
                RuntimeException failure = nextPostFailure;
                nextPostFailure = null;
                throw failure;
            }
            String activityId = "activity-" + activitySequence.incrementAndGet();
            posted.add(new PostedActivity(externalSessionId, content,
                options == null ? ActivityPostOptions.NONE : options, activityId));
            return new ActivityPostResult(activityId);
        }
    }

    @Override
    public synchronized String createAgentSession(String workItemId) {
        if (nextCreateFailure != null) {
            RuntimeException failure = nextCreateFailure;
            nextCreateFailure = null;
            throw failure;
        }
        String sessionId = "agent-session-" + sessionSequence.incrementAndGet();
        createdSessions.add(sessionId);
        return sessionId;
    }

    // ========== Test Controls ==========

    public synchronized void failNextPost(RuntimeException failure) {
        this.nextPostFailure = failure;
    }

    public synchronized void failNextCreate(RuntimeException failure) {
        this.nextCreateFailure = failure;
    }

    public synchronized List<PostedActivity> posted() {
        return List.copyOf(posted);
    }

    public synchronized List<PostedActivity> postedTo(String sessionId) {
        return posted.stream()
            .filter(activity -> activity.sessionId().equals(sessionId))
            .collect(Collectors.toList());
    }

    /**
     * Bodies of posts of one type, in order. Actions are rendered as {@code action: parameter}.
     *
     * @param type activity type
     * @return bodies
     */
    public synchronized List<String> bodiesOf(ActivityType type) {
        return posted.stream()
            .map(PostedActivity::content)
            .filter(content -> content.type() == type)
            .map(content -> type == ActivityType.ACTION
                ? content.action() + ": " + content.parameter()
                : content.body())
            .collect(Collectors.toList());
    }

    public synchronized List<String> createdSessions() {
        return List.copyOf(createdSessions);
    }

    public synchronized void clear() {
        posted.clear();
    }
}
