package com.ryuqq.agentsession.adapter.inmemory.activity;

import com.ryuqq.agentsession.core.activity.ActivityContent;
import com.ryuqq.agentsession.core.activity.ActivityPostOptions;
import com.ryuqq.agentsession.core.activity.ActivityPostResult;
import com.ryuqq.agentsession.core.activity.ActivityType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryActivitySinkTest {

    @Test
    void 세션과_활동_ID를_순서대로_발급한다() {
        // given
        InMemoryActivitySink sink = new InMemoryActivitySink();

        // when
        String first = sink.createAgentSession("issue-1");
        String second = sink.createAgentSession("issue-2");
        ActivityPostResult posted = sink.postActivity(first, ActivityContent.thought("hi"), ActivityPostOptions.NONE);

        // then
        assertThat(first).isEqualTo("agent-session-1");
        assertThat(second).isEqualTo("agent-session-2");
        assertThat(posted.id()).contains("activity-1");
        assertThat(sink.createdSessions()).containsExactly("agent-session-1", "agent-session-2");
    }

    @Test
    void 게시_내용을_타입별로_조회한다() {
        // given
        InMemoryActivitySink sink = new InMemoryActivitySink();
        sink.postActivity("s-1", ActivityContent.thought("thinking"), ActivityPostOptions.EPHEMERAL);
        sink.postActivity("s-1", ActivityContent.action("Bash", "ls", null), null);
        sink.postActivity("s-2", ActivityContent.response("done"), ActivityPostOptions.NONE);

        // when & then
        assertThat(sink.bodiesOf(ActivityType.THOUGHT)).containsExactly("thinking");
        assertThat(sink.bodiesOf(ActivityType.ACTION)).containsExactly("Bash: ls");
        assertThat(sink.postedTo("s-1")).hasSize(2);
        assertThat(sink.postedTo("s-1").get(0).options().ephemeral()).isTrue();
        assertThat(sink.postedTo("s-1").get(1).options()).isEqualTo(ActivityPostOptions.NONE);
    }

    @Test
    void 다음_게시만_실패시킨다() {
        // given
        InMemoryActivitySink sink = new InMemoryActivitySink();
        sink.failNextPost(new IllegalStateException("tracker down"));

        // when & then
        assertThatThrownBy(() -> sink.postActivity("s-1", ActivityContent.thought("a"), ActivityPostOptions.NONE))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("tracker down");
        sink.postActivity("s-1", ActivityContent.thought("b"), ActivityPostOptions.NONE);
        assertThat(sink.bodiesOf(ActivityType.THOUGHT)).containsExactly("b");
    }
}
