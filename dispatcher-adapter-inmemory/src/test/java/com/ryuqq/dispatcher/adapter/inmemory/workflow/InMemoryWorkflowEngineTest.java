package com.ryuqq.dispatcher.adapter.inmemory.workflow;

import com.ryuqq.dispatcher.core.exception.SubmissionException;
import com.ryuqq.dispatcher.core.model.OpId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryWorkflowEngine 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class InMemoryWorkflowEngineTest {

    @Test
    void submit_순차_runId_부여() throws SubmissionException {
        InMemoryWorkflowEngine engine = new InMemoryWorkflowEngine();

        String first = engine.submit(OpId.of("job-1"), "chaining", "{}");
        String second = engine.submit(OpId.of("job-2"), "chaining", "{}");

        assertThat(first).isEqualTo("wf-1");
        assertThat(second).isEqualTo("wf-2");
        assertThat(engine.submissions()).extracting(InMemoryWorkflowEngine.Submission::opId)
            .containsExactly(OpId.of("job-1"), OpId.of("job-2"));
    }

    @Test
    void submit_장애_모드면_SubmissionException() {
        InMemoryWorkflowEngine engine = new InMemoryWorkflowEngine();
        engine.setUnreachable(true);

        assertThatThrownBy(() -> engine.submit(OpId.of("job-1"), "chaining", "{}"))
            .isInstanceOf(SubmissionException.class);
        assertThat(engine.submissions()).isEmpty();
    }
}
