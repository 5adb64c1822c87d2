package com.ryuqq.dispatcher.core.exception;

/**
 * Dispatcher 예외의 최상위 타입.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DispatcherException extends RuntimeException {

    public DispatcherException(String message) {
        super(message);
    }

    public DispatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
