package com.ryuqq.dispatcher.core.outcome;

/**
 * 실패 결과.
 *
 * <p>errorCode는 기계가 읽을 수 있는 실패 사유입니다. 이 모듈이 만드는 코드는 상수로 정의되어 있습니다.</p>
 *
 * <ul>
 *   <li>{@link #SUBMISSION_FAILED}: 백엔드 호출/프로세스 실행/게시를 시작하지 못함</li>
 *   <li>{@link #UNKNOWN_ERROR}: 프로세스가 알림 없이 종료됨</li>
 *   <li>{@link #UNIT_FAILED}: Asynchronizer 하위 호출 중 하나가 실패함</li>
 *   <li>{@link #UNIT_TIMEOUT}: 동기 전용 백엔드의 하위 호출이 제한 시간 안에 완료되지 않음</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    public static final String SUBMISSION_FAILED = "SUBMISSION_FAILED";
    public static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";
    public static final String UNIT_FAILED = "UNIT_FAILED";
    public static final String UNIT_TIMEOUT = "UNIT_TIMEOUT";

    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
