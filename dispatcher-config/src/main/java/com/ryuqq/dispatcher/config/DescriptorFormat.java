package com.ryuqq.dispatcher.config;

import com.ryuqq.dispatcher.core.exception.ConfigurationException;

import java.util.Locale;

/**
 * 서비스 설정 파일 형식.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum DescriptorFormat {

    YAML,
    JSON;

    /**
     * 파일 확장자로 형식 결정.
     *
     * @param fileName 파일 이름 또는 경로
     * @return {@code .yml}/{@code .yaml}이면 YAML, {@code .json}이면 JSON
     * @throws ConfigurationException 확장자를 알 수 없는 경우
     */
    public static DescriptorFormat fromFileName(String fileName) {
        if (fileName == null) {
            throw new IllegalArgumentException("fileName cannot be null");
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
            return YAML;
        }
        if (lower.endsWith(".json")) {
            return JSON;
        }
        throw new ConfigurationException("Unknown service configuration format: " + fileName);
    }
}
