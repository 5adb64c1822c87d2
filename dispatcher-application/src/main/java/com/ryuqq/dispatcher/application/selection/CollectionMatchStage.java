package com.ryuqq.dispatcher.application.selection;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operation이 참조하는 모든 컬렉션을 제공하는 서비스만 남깁니다.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class CollectionMatchStage implements EliminationStage {

    static final String REASON = "no services are configured for the collection";

    @Override
    public StageResult apply(Operation operation, RequestContext context, List<CapabilityDescriptor> candidates) {
        List<String> collections = operation.getCollections();
        List<CapabilityDescriptor> matches = candidates.stream()
            .filter(descriptor -> descriptor.servesAll(collections))
            .collect(Collectors.toList());
        return StageResult.of(matches, REASON);
    }
}
