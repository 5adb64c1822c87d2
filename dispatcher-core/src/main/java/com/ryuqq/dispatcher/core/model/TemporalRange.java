package com.ryuqq.dispatcher.core.model;

import java.time.Instant;

/**
 * 시간 서브세팅 범위. 양 끝 모두 열려 있을 수 있습니다 (null).
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public record TemporalRange(
    Instant start,
    Instant end
) {

    public TemporalRange {
        if (start == null && end == null) {
            throw new IllegalArgumentException("start and end cannot both be null");
        }
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end (start: " + start + ", end: " + end + ")");
        }
    }

    public static TemporalRange of(Instant start, Instant end) {
        return new TemporalRange(start, end);
    }
}
