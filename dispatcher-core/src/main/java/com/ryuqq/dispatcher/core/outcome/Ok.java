package com.ryuqq.dispatcher.core.outcome;

import com.ryuqq.dispatcher.core.model.OpId;

/**
 * 성공 결과.
 *
 * @param opId Operation ID
 * @param message 결과 메시지 (선택, null 가능). no-match 대체 경로에서는 설명 문구를 담습니다.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Ok(
    OpId opId,
    String message
) implements Outcome {

    public Ok {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
    }

    public static Ok of(OpId opId) {
        return new Ok(opId, null);
    }

    public static Ok of(OpId opId, String message) {
        return new Ok(opId, message);
    }
}
