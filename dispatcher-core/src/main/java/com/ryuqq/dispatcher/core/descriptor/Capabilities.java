package com.ryuqq.dispatcher.core.descriptor;

import com.ryuqq.dispatcher.core.model.MediaTypes;

import java.util.List;

/**
 * 서비스가 선언한 처리 능력.
 *
 * @param outputFormats 지원 출력 형식 (선언 순서 유지)
 * @param variableSubsetting 변수 서브세팅 지원 여부
 * @param spatialSubsetting 공간(bbox) 서브세팅 지원 여부
 * @param singleUnitOnly 호출당 입력 단위 하나만 처리 가능 여부
 * @param synchronousOnly 동기 호출만 가능 여부
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Capabilities(
    List<String> outputFormats,
    boolean variableSubsetting,
    boolean spatialSubsetting,
    boolean singleUnitOnly,
    boolean synchronousOnly
) {

    public Capabilities {
        outputFormats = outputFormats == null ? List.of() : List.copyOf(outputFormats);
    }

    public static Capabilities none() {
        return new Capabilities(List.of(), false, false, false, false);
    }

    /**
     * 패턴을 만족하는 첫 번째 선언 형식.
     *
     * @param pattern 요청 형식 또는 와일드카드 패턴
     * @return 선언 순서상 첫 번째로 일치하는 형식, 없으면 null
     */
    public String firstFormatAccepting(String pattern) {
        for (String format : outputFormats) {
            if (MediaTypes.isAccepted(format, pattern)) {
                return format;
            }
        }
        return null;
    }

    public boolean supportsFormat(String pattern) {
        return firstFormatAccepting(pattern) != null;
    }

    /**
     * Asynchronizer로 감싸야 하는지 여부.
     *
     * @return singleUnitOnly 또는 synchronousOnly이면 true
     */
    public boolean requiresAsynchronizer() {
        return singleUnitOnly || synchronousOnly;
    }
}
