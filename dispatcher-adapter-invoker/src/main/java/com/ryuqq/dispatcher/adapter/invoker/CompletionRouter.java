package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 외부에서 도착한 Completion Notification을 진행 중인 Operation으로 보내는 진입점.
 *
 * <p>서비스(컨테이너, HTTP 백엔드, 큐 소비자, 워크플로)는 자신이 받은 completion 주소로 알리고,
 * 그 주소를 받는 쪽은 해당 Operation과 결과를 이 router에 넘깁니다. 경로는 OpId 기준입니다.</p>
 *
 * <pre>
 * parent      → CompletionGuard → 호출자 sink
 * parent.N    → Asynchronizer.unitSink() → (집계) → CompletionGuard → 호출자 sink
 * 알 수 없는 ID → WARN 로그 후 버림
 * </pre>
 *
 * <p>부모가 종료 상태가 되면 부모와 하위 단위의 경로가 함께 제거되므로, 이후 도착한 알림은 버려집니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class CompletionRouter implements CompletionSink {

    private static final Logger log = LoggerFactory.getLogger(CompletionRouter.class);

    private final CompletionSink caller;
    private final ConcurrentHashMap<OpId, CompletionSink> routes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<OpId, List<OpId>> unitsByParent = new ConcurrentHashMap<>();

    public CompletionRouter(CompletionSink caller) {
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
        this.caller = caller;
    }

    /**
     * Operation 하나의 경로를 엽니다.
     *
     * @param opId 부모 Operation ID
     * @return 호출자 sink를 감싼 guard (PENDING으로 등록됨)
     * @throws IllegalStateException 같은 ID가 이미 진행 중인 경우
     */
    CompletionGuard open(OpId opId) {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        CompletionGuard guard = new CompletionGuard(new ReleasingSink(opId));
        if (routes.putIfAbsent(opId, guard) != null) {
            throw new IllegalStateException("Operation " + opId.getValue() + " is already in flight");
        }
        guard.register(opId);
        return guard;
    }

    /**
     * 하위 단위 알림을 Asynchronizer의 unit sink로 보내도록 등록합니다.
     *
     * @param parent 부모 Operation ID
     * @param units 하위 단위 ID 목록
     * @param unitSink 단위 알림을 받을 sink
     */
    void routeUnits(OpId parent, List<OpId> units, CompletionSink unitSink) {
        if (!routes.containsKey(parent)) {
            throw new IllegalStateException("Operation " + parent.getValue() + " is not in flight");
        }
        unitsByParent.put(parent, List.copyOf(units));
        for (OpId unit : units) {
            routes.put(unit, unitSink);
        }
    }

    /**
     * 부모와 하위 단위의 경로를 제거합니다.
     *
     * @param parent 부모 Operation ID
     */
    void release(OpId parent) {
        routes.remove(parent);
        List<OpId> units = unitsByParent.remove(parent);
        if (units != null) {
            units.forEach(routes::remove);
        }
    }

    @Override
    public void complete(Operation operation, Outcome outcome) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        CompletionSink route = routes.get(operation.getOpId());
        if (route == null) {
            log.warn("Dropping completion for {} ({}): no operation in flight with that id",
                operation.getOpId().getValue(), outcome);
            return;
        }
        route.complete(operation, outcome);
    }

    @Override
    public boolean isAwaiting(OpId opId) {
        CompletionSink route = routes.get(opId);
        return route != null && route.isAwaiting(opId);
    }

    /**
     * @return 현재 경로가 열려 있는 ID 수 (부모 + 하위 단위)
     */
    public int inFlight() {
        return routes.size();
    }

    private final class ReleasingSink implements CompletionSink {

        private final OpId parent;

        private ReleasingSink(OpId parent) {
            this.parent = parent;
        }

        @Override
        public void complete(Operation operation, Outcome outcome) {
            try {
                caller.complete(operation, outcome);
            } finally {
                release(parent);
            }
        }

        @Override
        public boolean isAwaiting(OpId opId) {
            return caller.isAwaiting(opId);
        }
    }
}
