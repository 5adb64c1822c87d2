package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import com.ryuqq.dispatcher.core.spi.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 워크플로 엔진 제출 어댑터.
 *
 * <p>서비스 파라미터 {@code template}의 워크플로로 Operation을 넘기고 반환합니다.
 * 완료 알림은 엔진이 책임지며, 제출 실패만 이 어댑터가 실패 알림으로 전달합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class WorkflowInvocationAdapter extends AbstractInvocationAdapter {

    private static final Logger log = LoggerFactory.getLogger(WorkflowInvocationAdapter.class);

    public static final String TEMPLATE_PARAM = "template";

    private final WorkflowEngine engine;
    private final OperationSerializer serializer;

    public WorkflowInvocationAdapter(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink,
                                     WorkflowEngine engine, OperationSerializer serializer) {
        super(descriptor, operation, sink);
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.engine = engine;
        this.serializer = serializer;
    }

    @Override
    protected void doSubmit() throws Exception {
        String template = descriptor.requireParam(TEMPLATE_PARAM);
        String runId = engine.submit(operation.getOpId(), template, serializer.serialize(operation));
        log.info("Workflow {} started for {} from template {}", runId, operation.getOpId().getValue(), template);
    }
}
