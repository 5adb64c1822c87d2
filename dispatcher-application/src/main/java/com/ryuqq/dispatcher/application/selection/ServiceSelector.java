package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptorStore;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 서비스 선택기.
 *
 * <p>Capability Descriptor Store의 모든 서비스를 후보로 Elimination Pipeline을 실행하고,
 * 마지막까지 남은 후보 중 선언 순서상 첫 번째 서비스를 선택합니다.</p>
 *
 * <p><strong>파이프라인 (고정 순서):</strong></p>
 * <ol>
 *   <li>{@link CollectionMatchStage}</li>
 *   <li>{@link VariableSubsettingStage}</li>
 *   <li>{@link OutputFormatStage}</li>
 *   <li>{@link SpatialSubsettingStage}</li>
 * </ol>
 *
 * <p><strong>Fallback:</strong> 어느 단계든 {@link StageResult.Unsupported}를 돌려주면 선택은
 * 실패하지 않고 {@link CapabilityDescriptor#noMatch(String)} 서비스를 반환합니다.
 * 설명은 {@link UnsupportedCombinationMessage}가 만듭니다. 그 밖의 예외는 그대로 전파됩니다.</p>
 *
 * <p><strong>동시성:</strong> Store는 읽기 전용이므로 여러 스레드가 동시에 select를
 * 호출할 수 있습니다. 각 호출은 자신의 Operation의 출력 형식만 변경합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ServiceSelector {

    private static final Logger log = LoggerFactory.getLogger(ServiceSelector.class);

    private static final List<EliminationStage> DEFAULT_STAGES = List.of(
        new CollectionMatchStage(),
        new VariableSubsettingStage(),
        new OutputFormatStage(),
        new SpatialSubsettingStage()
    );

    private final CapabilityDescriptorStore store;
    private final List<EliminationStage> stages;

    /**
     * 기본 파이프라인으로 생성.
     *
     * @param store 초기화가 끝난 서비스 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public ServiceSelector(CapabilityDescriptorStore store) {
        this(store, DEFAULT_STAGES);
    }

    /**
     * 지정한 단계 목록으로 생성.
     *
     * @param store 초기화가 끝난 서비스 저장소
     * @param stages 순서대로 실행할 단계
     * @throws IllegalArgumentException store 또는 stages가 null이거나 stages가 비어 있는 경우
     */
    public ServiceSelector(CapabilityDescriptorStore store, List<EliminationStage> stages) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stages cannot be null or empty");
        }
        this.store = store;
        this.stages = List.copyOf(stages);
    }

    /**
     * Store의 모든 서비스를 후보로 선택.
     *
     * @param operation 처리할 Operation (출력 형식이 기록될 수 있음)
     * @param context 요청 컨텍스트
     * @return 선택된 서비스 또는 no-match 서비스
     */
    public CapabilityDescriptor select(Operation operation, RequestContext context) {
        return select(operation, context, store.all());
    }

    /**
     * 주어진 후보 집합에서 선택.
     *
     * @param operation 처리할 Operation (출력 형식이 기록될 수 있음)
     * @param context 요청 컨텍스트
     * @param candidates 후보 서비스 (선언 순서)
     * @return 선택된 서비스 또는 no-match 서비스, 절대 null 아님
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CapabilityDescriptor select(Operation operation, RequestContext context,
                                       List<CapabilityDescriptor> candidates) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (candidates == null) {
            throw new IllegalArgumentException("candidates cannot be null");
        }

        long startedAt = System.nanoTime();
        log.debug("Selecting service for {} from {} candidates", operation.getOpId().getValue(), candidates.size());

        List<CapabilityDescriptor> remaining = candidates;
        for (EliminationStage stage : stages) {
            StageResult result = stage.apply(operation, context, remaining);
            if (result instanceof StageResult.Unsupported unsupported) {
                log.info("Returning download links because {}.", unsupported.reason());
                return CapabilityDescriptor.noMatch(UnsupportedCombinationMessage.build(operation, context));
            }
            remaining = ((StageResult.Narrowed) result).candidates();
        }

        CapabilityDescriptor chosen = remaining.get(0);
        long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
        log.info("Selected service {} for {} ({} of {} candidates remained, {}ms)",
            chosen.name(), operation.getOpId().getValue(), remaining.size(), candidates.size(), elapsedMs);
        return chosen;
    }
}
