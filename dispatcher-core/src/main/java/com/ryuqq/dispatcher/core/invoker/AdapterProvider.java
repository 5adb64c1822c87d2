package com.ryuqq.dispatcher.core.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.spi.CompletionSink;

/**
 * Mechanism 하나에 대한 기본 어댑터 생성기.
 *
 * <p>서비스 팩토리는 시작 시 Mechanism별로 생성기를 등록하고, Asynchronizer는
 * 하위 Operation마다 같은 생성기로 감싸인 어댑터를 새로 만듭니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AdapterProvider {

    /**
     * 어댑터 생성.
     *
     * @param descriptor 선택된 서비스
     * @param operation 처리할 Operation
     * @param sink Completion Notification을 받을 대상
     * @return 아직 제출되지 않은 어댑터
     */
    InvocationAdapter create(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink);
}
