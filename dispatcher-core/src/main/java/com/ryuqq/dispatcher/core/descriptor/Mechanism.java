package com.ryuqq.dispatcher.core.descriptor;

import com.ryuqq.dispatcher.core.exception.ConfigurationException;

import java.util.List;

/**
 * 서비스 호출 방식.
 *
 * <p>서비스 설정의 {@code type.name} 태그를 닫힌 열거형으로 매핑합니다.
 * 알 수 없는 태그는 구성 오류입니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum Mechanism {

    /**
     * 직렬화된 Operation을 HTTP로 한 번 전송. 원격 서비스가 직접 callback을 호출합니다.
     */
    HTTP(List.of("http")),

    /**
     * 로컬 컨테이너 프로세스 실행.
     */
    LOCAL_PROCESS(List.of("docker")),

    /**
     * 외부 워크플로 엔진 제출.
     */
    WORKFLOW(List.of("workflow", "argo")),

    /**
     * 메시지 큐 게시.
     */
    QUEUE(List.of("queue")),

    /**
     * 실행 가능한 서비스가 없을 때의 대체 경로 (다운로드 링크만 반환).
     */
    NO_OP(List.of("noOp"));

    private final List<String> tags;

    Mechanism(List<String> tags) {
        this.tags = tags;
    }

    /**
     * 설정 파일에서 사용하는 기본 태그.
     *
     * @return 태그 문자열
     */
    public String tag() {
        return tags.get(0);
    }

    /**
     * 태그로 Mechanism 조회.
     *
     * @param tag 설정 파일의 type 이름
     * @return 대응하는 Mechanism
     * @throws ConfigurationException 알 수 없는 태그인 경우
     */
    public static Mechanism fromTag(String tag) {
        if (tag != null) {
            for (Mechanism mechanism : values()) {
                if (mechanism.tags.contains(tag)) {
                    return mechanism;
                }
            }
        }
        throw new ConfigurationException("Unknown service mechanism \"" + tag + "\"");
    }
}
