package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;

import java.util.List;

/**
 * 제거 단계의 결과.
 *
 * <ul>
 *   <li>{@link Narrowed}: 하나 이상의 후보가 남음</li>
 *   <li>{@link Unsupported}: 후보가 모두 제거됨 (예외가 아닌 예상된 결과)</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public sealed interface StageResult permits StageResult.Narrowed, StageResult.Unsupported {

    /**
     * 남은 후보 목록을 검사해 결과 생성.
     *
     * @param remaining 남은 후보
     * @param reason 비어 있을 때 사용할 이유
     * @return remaining이 비었으면 Unsupported, 아니면 Narrowed
     */
    static StageResult of(List<CapabilityDescriptor> remaining, String reason) {
        if (remaining.isEmpty()) {
            return new Unsupported(reason);
        }
        return new Narrowed(remaining);
    }

    /**
     * 후보가 남은 결과.
     *
     * @param candidates 남은 후보 (비어 있지 않음)
     */
    record Narrowed(List<CapabilityDescriptor> candidates) implements StageResult {

        public Narrowed {
            if (candidates == null || candidates.isEmpty()) {
                throw new IllegalArgumentException("candidates cannot be null or empty");
            }
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * 후보가 모두 제거된 결과.
     *
     * @param reason 제거 단계가 남긴 이유
     */
    record Unsupported(String reason) implements StageResult {

        public Unsupported {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
