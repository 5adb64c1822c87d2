package com.ryuqq.dispatcher.config;

/**
 * 서비스 설정 로딩 설정 (불변 record).
 *
 * <p>설정 파일은 최상위 키(profile)마다 서비스 목록을 가집니다. 배포 환경에 맞는
 * profile 하나만 읽습니다.</p>
 *
 * @param profile 읽을 최상위 키
 * @param maxGranuleLimit 배포 전체의 요청당 최대 granule 수
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record DescriptorLoaderConfig(
    String profile,
    int maxGranuleLimit
) {

    public static final String DEFAULT_PROFILE = "default";
    public static final int DEFAULT_MAX_GRANULE_LIMIT = 350;

    public DescriptorLoaderConfig {
        if (profile == null || profile.isBlank()) {
            throw new IllegalArgumentException("profile cannot be null or blank");
        }
        if (maxGranuleLimit <= 0) {
            throw new IllegalArgumentException("maxGranuleLimit must be positive");
        }
    }

    /**
     * 기본 설정.
     * <ul>
     *   <li>profile: default</li>
     *   <li>maxGranuleLimit: 350</li>
     * </ul>
     */
    public DescriptorLoaderConfig() {
        this(DEFAULT_PROFILE, DEFAULT_MAX_GRANULE_LIMIT);
    }

    public DescriptorLoaderConfig withProfile(String profile) {
        return new DescriptorLoaderConfig(profile, maxGranuleLimit);
    }

    public DescriptorLoaderConfig withMaxGranuleLimit(int maxGranuleLimit) {
        return new DescriptorLoaderConfig(profile, maxGranuleLimit);
    }
}
