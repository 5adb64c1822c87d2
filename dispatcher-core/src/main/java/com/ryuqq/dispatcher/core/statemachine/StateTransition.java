package com.ryuqq.dispatcher.core.statemachine;

/**
 * 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS</li>
 *   <li>PENDING → FAILED (제출 실패)</li>
 *   <li>IN_PROGRESS → COMPLETED</li>
 *   <li>IN_PROGRESS → FAILED</li>
 * </ul>
 *
 * <p>종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이가 허용되는지 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 다음 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(OperationState from, OperationState to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case PENDING -> to == OperationState.IN_PROGRESS || to == OperationState.FAILED;
            case IN_PROGRESS -> to.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OperationState from, OperationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException("Operation already reached terminal state " + from + ", cannot move to " + to);
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException("Invalid state transition " + from + " -> " + to);
        }
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static OperationState transition(OperationState current, OperationState next) {
        validate(current, next);
        return next;
    }
}
