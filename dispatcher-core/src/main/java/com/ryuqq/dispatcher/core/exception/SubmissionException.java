package com.ryuqq.dispatcher.core.exception;

/**
 * 외부 협력자가 작업 인계를 거부했을 때 SPI가 던지는 예외.
 *
 * <p>어댑터는 이 예외를 호출자에게 전파하지 않고 실패 Completion Notification으로 변환합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class SubmissionException extends Exception {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
