package com.ryuqq.dispatcher.adapter.invoker;

import java.util.List;
import java.util.Map;

/**
 * 로컬 프로세스 어댑터 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>launcherPrefix: 이미지 앞에 붙는 실행 명령 (기본 {@code docker run --rm -t})</li>
 *   <li>callbackHost: completion 주소의 {@code localhost}를 대체할 호스트 (기본 {@code host.docker.internal})</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 * @param launcherPrefix 실행 명령 접두어 (비어 있으면 안 됨)
 * @param callbackHost 컨테이너에서 호출자에 접근할 호스트명
 */
public record LocalProcessConfig(
    List<String> launcherPrefix,
    String callbackHost
) {

    public static final List<String> DEFAULT_LAUNCHER_PREFIX = List.of("docker", "run", "--rm", "-t");
    public static final String DEFAULT_CALLBACK_HOST = "host.docker.internal";

    /**
     * callback host를 덮어쓰는 환경 변수 이름.
     */
    public static final String CALLBACK_HOST_VARIABLE = "CALLBACK_HOST";

    /**
     * 기본 설정 생성자.
     */
    public LocalProcessConfig() {
        this(DEFAULT_LAUNCHER_PREFIX, DEFAULT_CALLBACK_HOST);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LocalProcessConfig {
        if (launcherPrefix == null || launcherPrefix.isEmpty()) {
            throw new IllegalArgumentException("launcherPrefix cannot be null or empty");
        }
        if (callbackHost == null || callbackHost.isBlank()) {
            throw new IllegalArgumentException("callbackHost cannot be null or blank");
        }
        launcherPrefix = List.copyOf(launcherPrefix);
    }

    /**
     * 프로세스 환경에서 설정 생성.
     *
     * @param environment 보통 {@code System.getenv()}
     * @return CALLBACK_HOST가 있으면 그 값을, 없으면 기본 호스트를 쓰는 설정
     */
    public static LocalProcessConfig fromEnvironment(Map<String, String> environment) {
        String host = environment.get(CALLBACK_HOST_VARIABLE);
        if (host == null || host.isBlank()) {
            return new LocalProcessConfig();
        }
        return new LocalProcessConfig(DEFAULT_LAUNCHER_PREFIX, host);
    }

    public LocalProcessConfig withLauncherPrefix(List<String> launcherPrefix) {
        return new LocalProcessConfig(launcherPrefix, callbackHost);
    }

    public LocalProcessConfig withCallbackHost(String callbackHost) {
        return new LocalProcessConfig(launcherPrefix, callbackHost);
    }
}
