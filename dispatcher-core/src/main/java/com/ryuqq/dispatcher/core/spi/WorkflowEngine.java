package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.exception.SubmissionException;
import com.ryuqq.dispatcher.core.model.OpId;

/**
 * External workflow-engine SPI.
 *
 * <p>The engine owns execution once a submission is accepted and is responsible for
 * eventually notifying the operation's completion address.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface WorkflowEngine {

    /**
     * Submits a workflow run.
     *
     * @param opId operation being submitted (used as the run's correlation key)
     * @param template workflow template name from the service's parameters
     * @param serializedOperation serialized operation handed to the workflow
     * @return engine-assigned workflow run identifier
     * @throws SubmissionException if the engine is unreachable or refused the run
     */
    String submit(OpId opId, String template, String serializedOperation) throws SubmissionException;
}
