package com.ryuqq.dispatcher.core.model;

import java.util.Locale;

/**
 * 미디어 타입 패턴 매칭.
 *
 * <p>서비스가 선언한 구체적 형식(예: {@code image/png})이 호출자가 보낸 패턴
 * ({@code image/png}, {@code image/*}, {@code *}{@code /*}, {@code *})을 만족하는지 판정합니다.
 * 대소문자를 구분하지 않으며 {@code ;q=0.8} 같은 파라미터는 무시합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class MediaTypes {

    public static final String ANY = "*/*";

    private MediaTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 형식이 패턴에 의해 수용되는지 확인.
     *
     * @param format 서비스가 선언한 구체적 형식
     * @param pattern 호출자가 요청한 형식 또는 와일드카드 패턴
     * @return 수용되면 true
     */
    public static boolean isAccepted(String format, String pattern) {
        if (format == null || pattern == null) {
            return false;
        }
        String value = normalize(format);
        String wanted = normalize(pattern);

        if (wanted.equals("*") || wanted.equals(ANY)) {
            return true;
        }
        if (wanted.endsWith("/*")) {
            String type = wanted.substring(0, wanted.length() - 1);
            return value.startsWith(type);
        }
        return value.equals(wanted);
    }

    /**
     * 재포맷 요청이 아닌 전체 와일드카드인지 확인.
     *
     * @param pattern 미디어 타입 패턴
     * @return {@code *} 또는 {@code *}{@code /*}이면 true
     */
    public static boolean isAnyType(String pattern) {
        if (pattern == null) {
            return false;
        }
        String wanted = normalize(pattern);
        return wanted.equals("*") || wanted.equals(ANY);
    }

    private static String normalize(String mediaType) {
        int paramStart = mediaType.indexOf(';');
        String bare = paramStart >= 0 ? mediaType.substring(0, paramStart) : mediaType;
        return bare.trim().toLowerCase(Locale.ROOT);
    }
}
