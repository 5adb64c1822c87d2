package com.ryuqq.dispatcher.core.statemachine;

import com.ryuqq.dispatcher.core.outcome.Outcome;

/**
 * 호출 단위 Operation의 생명주기 상태.
 *
 * <pre>
 * PENDING
 *    │
 *    ▼ (어댑터 제출)
 * IN_PROGRESS
 *    │
 *    ├─► COMPLETED (Ok 전달)
 *    │
 *    └─► FAILED (Fail 전달)
 * </pre>
 *
 * <p>PENDING에서 곧바로 FAILED로 갈 수도 있습니다 (제출 자체가 실패한 경우).
 * 종료 상태에서의 전이는 두 번째 Completion Notification을 의미하므로 허용되지 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum OperationState {

    PENDING,

    IN_PROGRESS,

    COMPLETED,

    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Outcome이 이끄는 종료 상태.
     *
     * @param outcome 전달할 결과
     * @return Ok이면 COMPLETED, Fail이면 FAILED
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    public static OperationState terminalFor(Outcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        return outcome.isOk() ? COMPLETED : FAILED;
    }
}
