package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.core.session.TrackingMode;
import com.ryuqq.agentsession.core.session.WorkItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InboundEventTest {

    @Test
    void 세션_시작은_작업_항목이_필요하다() {
        assertThatThrownBy(() -> InboundEvent.sessionStart("repo-1", null, null, "x", null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workItem");
    }

    @Test
    void 세션_대상_이벤트는_세션_ID가_필요하다() {
        assertThatThrownBy(() -> InboundEvent.userPrompt(" ", "hello"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sessionId");
    }

    @Test
    void 기본값을_채운다() {
        // when
        InboundEvent event = InboundEvent.sessionStart(null, WorkItem.of("issue-1", "ENG-1", "Fix"), null, null, null,
            null, null);

        // then
        assertThat(event.text()).isEmpty();
        assertThat(event.labels()).isEmpty();
        assertThat(event.trackingMode()).isEqualTo(TrackingMode.TRACKED);
    }

    @Test
    void 예정된_단계를_실행하는_이벤트() {
        assertThat(EventKind.CHILD_RESULT.forcesPlannedSubroutine()).isTrue();
        assertThat(EventKind.SUBROUTINE_TRANSITION.forcesPlannedSubroutine()).isTrue();
        assertThat(EventKind.USER_PROMPT.forcesPlannedSubroutine()).isFalse();
        assertThat(InboundEvent.stopSignal("s-1").withRouting(List.of("codex"), "d").labels()).containsExactly("codex");
    }
}
