package com.ryuqq.dispatcher.adapter.invoker;

/**
 * HTTP 직접 호출 어댑터 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>connectTimeoutMs: 연결 타임아웃 (기본 10000ms)</li>
 *   <li>requestTimeoutMs: 요청 타임아웃 (기본 60000ms)</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 * @param connectTimeoutMs 연결 타임아웃 (밀리초, 양수여야 함)
 * @param requestTimeoutMs 요청 타임아웃 (밀리초, 양수여야 함)
 */
public record HttpInvokerConfig(
    long connectTimeoutMs,
    long requestTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     */
    public HttpInvokerConfig() {
        this(10_000, 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HttpInvokerConfig {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")"
            );
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")"
            );
        }
    }

    public HttpInvokerConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new HttpInvokerConfig(connectTimeoutMs, requestTimeoutMs);
    }

    public HttpInvokerConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new HttpInvokerConfig(connectTimeoutMs, requestTimeoutMs);
    }
}
