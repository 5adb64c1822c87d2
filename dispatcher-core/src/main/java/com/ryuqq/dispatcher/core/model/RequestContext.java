package com.ryuqq.dispatcher.core.model;

import java.util.List;

/**
 * Operation에 포함되지 않지만 서비스 선택에 영향을 주는 요청 부가 정보.
 *
 * <p>호출자가 수용 가능한 출력 미디어 타입을 선호 순서대로 담습니다
 * (예: {@code Accept} 헤더를 파싱한 결과). 선택 호출 하나의 범위에서만 쓰이며 불변입니다.</p>
 *
 * @param requestedMimeTypes 선호 순서대로 정렬된 미디어 타입 목록 (비어 있을 수 있음)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record RequestContext(
    List<String> requestedMimeTypes
) {

    private static final RequestContext EMPTY = new RequestContext(List.of());

    public RequestContext {
        requestedMimeTypes = requestedMimeTypes == null ? List.of() : List.copyOf(requestedMimeTypes);
    }

    public static RequestContext of(List<String> requestedMimeTypes) {
        return new RequestContext(requestedMimeTypes);
    }

    public static RequestContext of(String... requestedMimeTypes) {
        return new RequestContext(List.of(requestedMimeTypes));
    }

    public static RequestContext empty() {
        return EMPTY;
    }

    public boolean hasRequestedMimeTypes() {
        return !requestedMimeTypes.isEmpty();
    }
}
