package com.ryuqq.dispatcher.core.model;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Operation 식별자.
 *
 * <p>하나의 변환 요청(Operation)과 그 요청에 대해 전달되는 Completion Notification을
 * 연결하는 키입니다. Asynchronizer가 만드는 하위 Operation은 부모 식별자에
 * 순번을 붙인 파생 식별자를 사용합니다 (예: {@code job-42.3}).</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class OpId {

    private static final int MAX_LENGTH = 255;
    private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9\\-_.]+$");

    private final String value;

    private OpId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OpId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("OpId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID.matcher(value).matches()) {
            throw new IllegalArgumentException("OpId contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * OpId 생성.
     *
     * @param value OpId 값
     * @return OpId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OpId of(String value) {
        return new OpId(value);
    }

    /**
     * UUID 기반 OpId 생성.
     *
     * @return 새 OpId
     */
    public static OpId random() {
        return new OpId(UUID.randomUUID().toString());
    }

    /**
     * 하위 Operation용 파생 식별자.
     *
     * @param index 하위 단위 순번 (1부터)
     * @return {@code <value>.<index>} 형태의 OpId
     * @throws IllegalArgumentException index가 1보다 작은 경우
     */
    public OpId child(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive (current: " + index + ")");
        }
        return new OpId(value + "." + index);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((OpId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OpId{" + value + '}';
    }
}
