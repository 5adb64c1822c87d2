package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 변수를 지정한 소스가 있으면 변수 서브세팅을 지원하는 서비스만 남깁니다.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class VariableSubsettingStage implements EliminationStage {

    static final String REASON = "none of the services configured for the collection support variable subsetting";

    @Override
    public StageResult apply(Operation operation, RequestContext context, List<CapabilityDescriptor> candidates) {
        if (!operation.requiresVariableSubsetting()) {
            return StageResult.of(candidates, REASON);
        }
        List<CapabilityDescriptor> matches = candidates.stream()
            .filter(descriptor -> descriptor.capabilities().variableSubsetting())
            .collect(Collectors.toList());
        return StageResult.of(matches, REASON);
    }
}
