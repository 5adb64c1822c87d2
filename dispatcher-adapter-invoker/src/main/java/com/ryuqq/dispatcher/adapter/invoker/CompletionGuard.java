package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import com.ryuqq.dispatcher.core.statemachine.OperationState;
import com.ryuqq.dispatcher.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Completion Notification 1회 보장 래퍼.
 *
 * <p>호출자의 CompletionSink를 감싸고, Operation마다 상태를 추적합니다.
 * 종료 상태로의 전이는 한 번만 허용되며 이후 도착한 알림은 WARN 로그를 남기고 버립니다.</p>
 *
 * <pre>
 * register(opId)      → PENDING
 * markSubmitted(opId) → IN_PROGRESS
 * complete(Ok)        → COMPLETED  (delegate 호출)
 * complete(Fail)      → FAILED     (delegate 호출)
 * complete(...)       → 이미 종료 상태면 무시
 * </pre>
 *
 * <p>등록되지 않은 Operation은 IN_PROGRESS로 간주합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class CompletionGuard implements CompletionSink {

    private static final Logger log = LoggerFactory.getLogger(CompletionGuard.class);

    private final CompletionSink delegate;
    private final ConcurrentHashMap<OpId, OperationState> states = new ConcurrentHashMap<>();

    public CompletionGuard(CompletionSink delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Operation 추적 시작.
     *
     * @param opId Operation ID
     * @throws IllegalStateException 이미 추적 중인 경우
     */
    public void register(OpId opId) {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        if (states.putIfAbsent(opId, OperationState.PENDING) != null) {
            throw new IllegalStateException("Operation " + opId.getValue() + " is already registered");
        }
    }

    /**
     * 어댑터에 넘겼음을 기록. 이미 종료되었으면 아무것도 하지 않습니다.
     *
     * @param opId Operation ID
     */
    public void markSubmitted(OpId opId) {
        states.computeIfPresent(opId, (id, current) ->
            current == OperationState.PENDING
                ? StateTransition.transition(current, OperationState.IN_PROGRESS)
                : current);
    }

    @Override
    public void complete(Operation operation, Outcome outcome) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }

        OpId opId = operation.getOpId();
        OperationState target = OperationState.terminalFor(outcome);
        AtomicBoolean accepted = new AtomicBoolean(false);
        states.compute(opId, (id, current) -> {
            OperationState from = current == null ? OperationState.IN_PROGRESS : current;
            if (!StateTransition.isAllowed(from, target)) {
                return from;
            }
            accepted.set(true);
            return target;
        });

        if (!accepted.get()) {
            log.warn("Dropping duplicate completion for {} ({}): already {}",
                opId.getValue(), outcome, states.get(opId));
            return;
        }
        delegate.complete(operation, outcome);
    }

    /**
     * {@inheritDoc}
     *
     * <p>이 guard가 종료를 기록했거나 delegate가 이미 알림을 받았으면 false.</p>
     */
    @Override
    public boolean isAwaiting(OpId opId) {
        OperationState state = states.get(opId);
        if (state != null && state.isTerminal()) {
            return false;
        }
        return delegate.isAwaiting(opId);
    }

    /**
     * @param opId Operation ID
     * @return 추적 중인 상태, 없으면 null
     */
    public OperationState stateOf(OpId opId) {
        return states.get(opId);
    }
}
