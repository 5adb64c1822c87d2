package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.invoker.InvocationAdapter;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호출 어댑터 공통 골격.
 *
 * <p>{@link #submit()}은 한 번만 허용되고, 하위 클래스의 {@link #doSubmit()}이 던진 모든 예외를
 * {@link Fail#SUBMISSION_FAILED} 실패 알림으로 변환합니다. 어댑터 수준 실패가 제출 경계를
 * 넘어 예외로 전파되지 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public abstract class AbstractInvocationAdapter implements InvocationAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractInvocationAdapter.class);

    protected final CapabilityDescriptor descriptor;
    protected final Operation operation;
    protected final CompletionSink sink;

    private final AtomicBoolean submitted = new AtomicBoolean(false);

    protected AbstractInvocationAdapter(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.descriptor = descriptor;
        this.operation = operation;
        this.sink = sink;
    }

    @Override
    public final void submit() {
        if (!submitted.compareAndSet(false, true)) {
            throw new IllegalStateException("Operation " + operation.getOpId().getValue() + " was already submitted");
        }

        log.info("Submitting {} to {} via {}", operation.getOpId().getValue(), descriptor.name(),
            descriptor.mechanism().tag());
        try {
            doSubmit();
        } catch (Exception e) {
            failSubmission(e);
        }
    }

    @Override
    public OpId opId() {
        return operation.getOpId();
    }

    /**
     * 실제 제출. 즉시 반환해야 합니다.
     *
     * @throws Exception 제출 실패 (실패 알림으로 변환됨)
     */
    protected abstract void doSubmit() throws Exception;

    /**
     * 제출 실패를 실패 알림으로 전달.
     *
     * @param cause 실패 원인
     */
    protected void failSubmission(Throwable cause) {
        log.error("Submission of {} to {} failed", operation.getOpId().getValue(), descriptor.name(), cause);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        deliver(Fail.of(Fail.SUBMISSION_FAILED,
            "Service " + descriptor.name() + " could not accept the request: " + detail,
            cause.getClass().getName()));
    }

    /**
     * Completion Notification 전달.
     *
     * @param outcome 종료 결과
     */
    protected void deliver(Outcome outcome) {
        sink.complete(operation, outcome);
    }
}
