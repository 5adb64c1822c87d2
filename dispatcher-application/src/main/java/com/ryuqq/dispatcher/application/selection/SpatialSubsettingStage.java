package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operation에 bounding box가 있으면 공간 서브세팅을 지원하는 서비스만 남깁니다.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class SpatialSubsettingStage implements EliminationStage {

    static final String REASON = "none of the services configured for the collection support spatial subsetting";

    @Override
    public StageResult apply(Operation operation, RequestContext context, List<CapabilityDescriptor> candidates) {
        if (!operation.requiresSpatialSubsetting()) {
            return StageResult.of(candidates, REASON);
        }
        List<CapabilityDescriptor> matches = candidates.stream()
            .filter(descriptor -> descriptor.capabilities().spatialSubsetting())
            .collect(Collectors.toList());
        return StageResult.of(matches, REASON);
    }
}
