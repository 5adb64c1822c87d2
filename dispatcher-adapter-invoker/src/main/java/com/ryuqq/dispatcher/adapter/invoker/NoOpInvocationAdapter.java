package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Ok;
import com.ryuqq.dispatcher.core.spi.CompletionSink;

/**
 * No-op 어댑터.
 *
 * <p>실제 서비스 없이 즉시 Ok 알림을 보냅니다. 메시지는 no-match 서비스의 설명
 * (다운로드 링크만 제공하는 이유)입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class NoOpInvocationAdapter extends AbstractInvocationAdapter {

    public NoOpInvocationAdapter(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink) {
        super(descriptor, operation, sink);
    }

    @Override
    protected void doSubmit() {
        deliver(Ok.of(operation.getOpId(), descriptor.explanation()));
    }
}
