package com.ryuqq.dispatcher.core.exception;

/**
 * 배포 구성 결함.
 *
 * <p>알 수 없는 mechanism 태그, 어댑터가 등록되지 않은 mechanism, 형식이 잘못된
 * 서비스 설정 등 요청 단위로 복구할 수 없는 오류를 나타냅니다. 호출자 계층까지
 * 그대로 전파되며 서버 오류로 분류되어야 합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ConfigurationException extends DispatcherException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
