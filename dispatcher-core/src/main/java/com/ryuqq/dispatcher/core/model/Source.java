package com.ryuqq.dispatcher.core.model;

import java.util.List;

/**
 * Operation이 참조하는 소스 컬렉션 하나와 그 입력 단위들.
 *
 * <p>variables가 비어 있지 않으면 해당 소스에 대해 변수 서브세팅이 요청된 것입니다.</p>
 *
 * @param collection 컬렉션 식별자
 * @param variables 서브세팅할 변수 목록 (비어 있을 수 있음)
 * @param granules 확정된 입력 파일 목록 (비어 있을 수 있음)
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Source(
    String collection,
    List<String> variables,
    List<Granule> granules
) {

    public Source {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        variables = variables == null ? List.of() : List.copyOf(variables);
        granules = granules == null ? List.of() : List.copyOf(granules);
    }

    public static Source of(String collection, List<String> variables, List<Granule> granules) {
        return new Source(collection, variables, granules);
    }

    public static Source of(String collection) {
        return new Source(collection, List.of(), List.of());
    }

    public boolean hasVariables() {
        return !variables.isEmpty();
    }

    /**
     * 같은 컬렉션과 변수 목록에 granule 하나만 남긴 사본.
     *
     * @param granule 남길 granule
     * @return 새 Source
     */
    public Source withSingleGranule(Granule granule) {
        return new Source(collection, variables, List.of(granule));
    }
}
