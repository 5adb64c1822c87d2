package com.ryuqq.dispatcher.adapter.invoker;

/**
 * Asynchronizer 설정 (불변 record).
 *
 * <p>unitTimeoutMs는 동기 전용 서비스에서 다음 단위를 제출하기 전에 현재 단위의
 * 완료를 기다리는 최대 시간입니다 (기본 300000ms = 5분). 초과한 단위는
 * {@code UNIT_TIMEOUT} 실패로 기록됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 * @param unitTimeoutMs 단위별 완료 대기 시간 (밀리초, 양수여야 함)
 */
public record AsynchronizerConfig(long unitTimeoutMs) {

    public AsynchronizerConfig() {
        this(300_000);
    }

    public AsynchronizerConfig {
        if (unitTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "unitTimeoutMs must be positive (current: " + unitTimeoutMs + ")"
            );
        }
    }

    public AsynchronizerConfig withUnitTimeoutMs(long unitTimeoutMs) {
        return new AsynchronizerConfig(unitTimeoutMs);
    }
}
