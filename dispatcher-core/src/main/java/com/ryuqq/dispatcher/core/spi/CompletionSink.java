package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Outcome;

/**
 * Completion Notification 수신 SPI.
 *
 * <p>Operation의 completion 주소(callback)를 소유한 협력 계층이 구현합니다.
 * 주소 형식과 전달 프로토콜은 구현체가 정하며, 이 모듈은 알림이 <em>언제</em>,
 * <em>몇 번</em> 전달되는지만 보장합니다.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: adapters deliver from arbitrary threads</li>
 *   <li>Out-of-band completions (e.g. a child process calling the callback itself)
 *       must be reflected by {@link #isAwaiting(OpId)}</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface CompletionSink {

    /**
     * Completion Notification 전달.
     *
     * @param operation 완료된 Operation (callback 주소 포함)
     * @param outcome 종료 결과
     */
    void complete(Operation operation, Outcome outcome);

    /**
     * completion 주소가 아직 알림을 기다리는지 확인.
     *
     * <p>로컬 프로세스 어댑터는 자식 프로세스 종료 시 이 값으로 자식이 스스로
     * 알림을 보냈는지 판정합니다.</p>
     *
     * @param opId Operation ID
     * @return 아직 어떤 알림도 받지 않았으면 true
     */
    boolean isAwaiting(OpId opId);
}
