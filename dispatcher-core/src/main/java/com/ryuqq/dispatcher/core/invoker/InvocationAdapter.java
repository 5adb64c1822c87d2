package com.ryuqq.dispatcher.core.invoker;

import com.ryuqq.dispatcher.core.model.OpId;

/**
 * 호출 어댑터.
 *
 * <p>하나의 Operation과 하나의 Capability Descriptor에 묶여 생성되며, 해당 서비스의
 * 호출 방식(HTTP, 로컬 프로세스, 워크플로 엔진, 메시지 큐)으로 작업을 제출합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #submit()}은 제출 후 곧바로 반환합니다.</li>
 *   <li>제출 이후 Operation의 completion 주소로 정확히 하나의 Completion Notification이
 *       언젠가 전달됩니다 (성공 또는 실패).</li>
 *   <li>어댑터 수준의 실패는 예외로 전파되지 않고 실패 알림으로 변환됩니다.</li>
 * </ul>
 *
 * <p>인스턴스는 호출 하나가 독점하며, 한 번만 submit해야 합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface InvocationAdapter {

    /**
     * 작업 제출.
     *
     * @throws IllegalStateException 이미 제출된 어댑터에 다시 호출한 경우
     */
    void submit();

    /**
     * @return 이 어댑터가 담당하는 Operation ID
     */
    OpId opId();
}
