package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import com.ryuqq.dispatcher.core.spi.MessageChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 메시지 큐 발행 어댑터.
 *
 * <p>서비스 파라미터 {@code channel}로 직렬화된 Operation을 발행합니다.
 * 발행 성공은 완료가 아니며, 하위 소비자가 나중에 알림을 보냅니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class QueueInvocationAdapter extends AbstractInvocationAdapter {

    private static final Logger log = LoggerFactory.getLogger(QueueInvocationAdapter.class);

    public static final String CHANNEL_PARAM = "channel";

    private final MessageChannel channel;
    private final OperationSerializer serializer;

    public QueueInvocationAdapter(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink,
                                  MessageChannel channel, OperationSerializer serializer) {
        super(descriptor, operation, sink);
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.channel = channel;
        this.serializer = serializer;
    }

    @Override
    protected void doSubmit() throws Exception {
        String name = descriptor.requireParam(CHANNEL_PARAM);
        channel.publish(name, serializer.serialize(operation));
        log.debug("Published {} to channel {}", operation.getOpId().getValue(), name);
    }
}
