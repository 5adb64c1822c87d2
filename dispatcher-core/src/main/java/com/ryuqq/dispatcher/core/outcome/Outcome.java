package com.ryuqq.dispatcher.core.outcome;

/**
 * Completion Notification의 종료 결과.
 *
 * <p>Outcome은 두 가지 결과 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Ok}: 서비스가 요청을 처리했거나 대체 경로가 설명과 함께 완료됨</li>
 *   <li>{@link Fail}: 제출 실패, 백엔드 실패 또는 감지된 비정상 종료</li>
 * </ul>
 *
 * <p>제출된 모든 Operation에 대해 정확히 하나의 Outcome이 전달되어야 합니다.
 * 자동 재시도는 하지 않으므로 재시도 결과 타입은 없습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
