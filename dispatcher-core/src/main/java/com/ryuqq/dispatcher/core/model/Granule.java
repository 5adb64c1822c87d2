package com.ryuqq.dispatcher.core.model;

/**
 * 카탈로그 조회로 확정된 입력 파일 하나.
 *
 * @param id 카탈로그 상의 granule 식별자
 * @param name 표시 이름 (null 가능)
 * @param url 데이터 파일 위치
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record Granule(
    String id,
    String name,
    String url
) {

    public Granule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
    }

    public static Granule of(String id, String name, String url) {
        return new Granule(id, name, url);
    }
}
