package com.ryuqq.dispatcher.core.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 설정된 백엔드 서비스 하나의 능력과 호출 방식.
 *
 * <p>시작 시 한 번 로드되며 이후 불변입니다. 실행 가능한 서비스가 없을 때 쓰이는
 * no-match 설명자는 {@link #noMatch(String)}로 요청마다 새로 만들며, 어떤 컬렉션도
 * 서비스하지 않고 설명 문구(explanation)만 가집니다.</p>
 *
 * @param name 서비스 이름
 * @param mechanism 호출 방식
 * @param collections 서비스 가능한 컬렉션 식별자 목록
 * @param capabilities 처리 능력
 * @param params mechanism별 파라미터 (예: url, image, channel, template)
 * @param env 로컬 프로세스에 전달할 환경 변수 (선언 순서 유지)
 * @param maximumAsyncGranules 서비스가 허용하려는 최대 granule 수 (null 가능)
 * @param explanation no-match 설명자의 사람이 읽을 수 있는 사유 (그 외에는 null)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record CapabilityDescriptor(
    String name,
    Mechanism mechanism,
    List<String> collections,
    Capabilities capabilities,
    Map<String, String> params,
    Map<String, String> env,
    Integer maximumAsyncGranules,
    String explanation
) {

    public static final String NO_MATCH_NAME = "noOpService";

    private static final Capabilities NO_MATCH_CAPABILITIES =
        new Capabilities(List.of("application/json"), false, false, false, false);

    public CapabilityDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (mechanism == null) {
            throw new IllegalArgumentException("mechanism cannot be null");
        }
        collections = collections == null ? List.of() : List.copyOf(collections);
        capabilities = capabilities == null ? Capabilities.none() : capabilities;
        params = ordered(params);
        env = ordered(env);
    }

    public static CapabilityDescriptor of(String name, Mechanism mechanism, List<String> collections,
                                          Capabilities capabilities, Map<String, String> params) {
        return new CapabilityDescriptor(name, mechanism, collections, capabilities, params, Map.of(), null, null);
    }

    /**
     * no-match 대체 설명자 생성.
     *
     * @param explanation 실행 가능한 서비스가 없는 이유
     * @return NO_OP 설명자
     */
    public static CapabilityDescriptor noMatch(String explanation) {
        return new CapabilityDescriptor(NO_MATCH_NAME, Mechanism.NO_OP, List.of(), NO_MATCH_CAPABILITIES,
            Map.of(), Map.of(), null, explanation);
    }

    public boolean isNoMatch() {
        return mechanism == Mechanism.NO_OP;
    }

    /**
     * 모든 컬렉션을 서비스할 수 있는지 확인.
     *
     * @param collectionIds 확인할 컬렉션 식별자
     * @return 모두 포함되면 true
     */
    public boolean servesAll(List<String> collectionIds) {
        return collections.containsAll(collectionIds);
    }

    /**
     * 필수 mechanism 파라미터 조회.
     *
     * @param key 파라미터 이름
     * @return 파라미터 값
     * @throws IllegalStateException 값이 없거나 빈 경우
     */
    public String requireParam(String key) {
        String value = params.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Service " + name + " is missing required parameter \"" + key + "\"");
        }
        return value;
    }

    private static Map<String, String> ordered(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
