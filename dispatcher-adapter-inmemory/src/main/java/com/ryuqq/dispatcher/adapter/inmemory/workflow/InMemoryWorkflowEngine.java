package com.ryuqq.dispatcher.adapter.inmemory.workflow;

import com.ryuqq.dispatcher.core.exception.SubmissionException;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.spi.WorkflowEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link WorkflowEngine} SPI.
 *
 * <p>Accepted submissions are recorded with a sequential run id ({@code wf-1}, {@code wf-2}, ...).
 * Nothing is executed; a test plays the engine's part by notifying the completion sink itself.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class InMemoryWorkflowEngine implements WorkflowEngine {

    private final List<Submission> submissions = new CopyOnWriteArrayList<>();
    private final AtomicLong runSequence = new AtomicLong();

    private volatile boolean unreachable;

    @Override
    public String submit(OpId opId, String template, String serializedOperation) throws SubmissionException {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("template cannot be null or blank");
        }
        if (unreachable) {
            throw new SubmissionException("Workflow engine is unreachable");
        }

        String runId = "wf-" + runSequence.incrementAndGet();
        submissions.add(new Submission(runId, opId, template, serializedOperation));
        return runId;
    }

    /**
     * Simulates an engine outage.
     *
     * @param unreachable true to make every submit fail
     */
    public void setUnreachable(boolean unreachable) {
        this.unreachable = unreachable;
    }

    /**
     * Returns the accepted submissions in order. Used for test assertions.
     *
     * @return snapshot of submissions
     */
    public List<Submission> submissions() {
        return new ArrayList<>(submissions);
    }

    /**
     * Clears recorded submissions and resets the outage flag. Used for test cleanup.
     */
    public void clear() {
        submissions.clear();
        unreachable = false;
    }

    /**
     * An accepted workflow run.
     *
     * @param runId engine-assigned id
     * @param opId submitted operation
     * @param template workflow template name
     * @param serializedOperation payload handed to the workflow
     */
    public record Submission(String runId, OpId opId, String template, String serializedOperation) {
    }
}
