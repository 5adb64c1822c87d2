package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.application.dispatch.Dispatcher;
import com.ryuqq.dispatcher.application.dispatch.ServiceFactory;
import com.ryuqq.dispatcher.application.selection.ServiceSelector;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.invoker.InvocationAdapter;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기본 Dispatcher 구현.
 *
 * <p>Operation마다 {@link CompletionRouter}에서 새 {@link CompletionGuard}를 열어 어댑터에 넘기므로,
 * 어떤 경로로 알림이 겹쳐도 호출자에게는 한 번만 전달됩니다. Asynchronizer를 쓰는 서비스는
 * 하위 단위 ID도 router에 등록되어, 하위 completion 주소로 온 알림이 집계로 들어갑니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DefaultDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultDispatcher.class);

    private final ServiceSelector selector;
    private final ServiceFactory factory;
    private final CompletionRouter router;

    public DefaultDispatcher(ServiceSelector selector, ServiceFactory factory, CompletionSink sink) {
        if (selector == null) {
            throw new IllegalArgumentException("selector cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.selector = selector;
        this.factory = factory;
        this.router = new CompletionRouter(sink);
    }

    @Override
    public CapabilityDescriptor dispatch(Operation operation, RequestContext context) {
        CapabilityDescriptor chosen = selector.select(operation, context);

        OpId opId = operation.getOpId();
        CompletionGuard guard = router.open(opId);
        InvocationAdapter adapter;
        try {
            adapter = factory.build(chosen, operation, guard);
        } catch (RuntimeException e) {
            router.release(opId);
            throw e;
        }
        if (adapter instanceof Asynchronizer) {
            Asynchronizer asynchronizer = (Asynchronizer) adapter;
            router.routeUnits(opId,
                asynchronizer.units().stream().map(Operation::getOpId).toList(),
                asynchronizer.unitSink());
        }

        log.info("Dispatching {} to {} via {} (asynchronizer: {})", opId.getValue(), chosen.name(),
            chosen.mechanism().tag(), adapter instanceof Asynchronizer);
        guard.markSubmitted(opId);
        adapter.submit();
        return chosen;
    }

    @Override
    public CompletionRouter completionSink() {
        return router;
    }
}
