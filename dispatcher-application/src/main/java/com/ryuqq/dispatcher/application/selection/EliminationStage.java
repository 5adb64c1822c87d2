package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;

import java.util.List;

/**
 * 후보 서비스 제거 단계.
 *
 * <p>Elimination Pipeline의 한 단계로, 현재 남은 후보 집합을 받아 좁힌 집합을
 * 돌려주거나, 남은 후보가 없을 때 이유를 담은 {@link StageResult.Unsupported}를 돌려줍니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>후보 목록의 상대 순서를 유지해야 합니다 (선언 순서 tie-break).</li>
 *   <li>I/O나 블로킹 호출을 하지 않습니다.</li>
 *   <li>Operation에 대한 변경은 출력 형식 기록만 허용됩니다.</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EliminationStage {

    /**
     * 후보 집합 좁히기.
     *
     * @param operation 처리할 Operation
     * @param context 요청 컨텍스트
     * @param candidates 이전 단계까지 남은 후보 (선언 순서)
     * @return 좁혀진 후보 또는 Unsupported
     */
    StageResult apply(Operation operation, RequestContext context, List<CapabilityDescriptor> candidates);
}
