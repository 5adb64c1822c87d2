package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.exception.ConfigurationException;
import com.ryuqq.dispatcher.core.invoker.InvocationAdapter;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.spi.CompletionSink;

/**
 * 서비스 팩토리.
 *
 * <p>선택된 서비스의 Mechanism에 등록된 어댑터를 생성합니다. 서비스가 단일 단위 전용이거나
 * 동기 전용이면 기본 어댑터를 Asynchronizer로 감싸서 반환합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface ServiceFactory {

    /**
     * 어댑터 생성.
     *
     * @param descriptor 선택된 서비스
     * @param operation 처리할 Operation
     * @param sink Completion Notification 대상
     * @return 아직 제출되지 않은 어댑터
     * @throws ConfigurationException 서비스의 Mechanism에 등록된 어댑터가 없는 경우
     */
    InvocationAdapter build(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink);
}
