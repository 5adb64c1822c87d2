package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;
import com.ryuqq.dispatcher.core.spi.CompletionSink;

/**
 * 선택과 호출을 묶는 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CapabilityDescriptor chosen = dispatcher.dispatch(operation, RequestContext.of("image/png", "*&#47;*"));
 * log.info("Dispatched {} to {}", operation.getOpId(), chosen.name());
 * // Completion Notification은 CompletionSink로 나중에 도착
 *
 * // completion 주소로 들어온 서비스의 알림
 * dispatcher.completionSink().complete(reportedOperation, outcome);
 * </pre>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>ServiceSelector로 서비스 선택 (실패 시 no-match 서비스)</li>
 *   <li>ServiceFactory로 어댑터 생성</li>
 *   <li>어댑터 submit (즉시 반환)</li>
 * </ol>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * Operation을 선택된 서비스로 보냅니다.
     *
     * <p>선택/생성 단계의 예외(설정 오류 등)는 호출자에게 전파되지만, 제출 이후의 실패는
     * 예외가 아닌 실패 알림으로만 전달됩니다.</p>
     *
     * @param operation 처리할 Operation
     * @param context 요청 컨텍스트
     * @return 선택된 서비스 (로깅/텔레메트리용)
     * @throws com.ryuqq.dispatcher.core.exception.ConfigurationException 배포 설정 오류
     */
    CapabilityDescriptor dispatch(Operation operation, RequestContext context);

    /**
     * 서비스가 completion 주소로 보낸 알림을 받는 진입점.
     *
     * <p>부모 Operation의 알림은 호출자에게 한 번만 전달되고, 하위 단위({@code parent.N})의 알림은
     * 집계로 들어갑니다. 진행 중이 아닌 Operation의 알림은 버려집니다.</p>
     *
     * @return 외부 알림용 CompletionSink
     */
    CompletionSink completionSink();
}
