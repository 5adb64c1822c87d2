package com.ryuqq.dispatcher.adapter.invoker;

import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.invoker.AdapterProvider;
import com.ryuqq.dispatcher.core.invoker.InvocationAdapter;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Ok;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.spi.CompletionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단일 단위 전용 / 동기 전용 서비스용 어댑터 데코레이터.
 *
 * <p>Operation을 granule 하나씩 담은 하위 Operation으로 나누고, 기본 어댑터를 하위 Operation마다
 * 하나씩 입력 순서대로 생성해 제출합니다. 하위 결과는 하나의 논리적 Completion Notification으로
 * 모아 원래 completion 주소로 보냅니다.</p>
 *
 * <p><strong>집계 규칙:</strong></p>
 * <ul>
 *   <li>모든 하위 단위가 Ok: Ok 한 번</li>
 *   <li>어느 하위 단위든 Fail: 그 시점에 {@code UNIT_FAILED} 한 번, 이후 결과는 버림
 *       (남은 단위는 계속 실행)</li>
 *   <li>같은 단위의 중복 알림: 무시</li>
 * </ul>
 *
 * <p><strong>동기 전용 서비스:</strong> 다음 단위를 제출하기 전에 현재 단위의 완료를
 * {@link AsynchronizerConfig#unitTimeoutMs()}까지 기다립니다. 시간 안에 끝나지 않은 단위는
 * {@code UNIT_TIMEOUT} 실패로 기록됩니다. 단일 단위 전용이기만 한 서비스는 기다리지 않고
 * 순서대로 제출만 합니다.</p>
 *
 * <p>하위 단위는 {@link #unitSink()}로 알림을 받습니다. 기본 어댑터가 스스로 만드는 알림
 * (제출 실패, 동기 응답, 프로세스 비정상 종료)은 자동으로 여기에 도착합니다. 하위 Operation은
 * 각자의 completion 주소({@link Operation#unitCallback(int)})를 받으므로, 원격 서비스가 그 주소로 보낸
 * 알림은 {@link CompletionRouter}를 거쳐 이 sink에 도착합니다.</p>
 *
 * <p>submit은 하위 단위 실행을 executor에 넘기고 즉시 반환합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class Asynchronizer implements InvocationAdapter {

    private static final Logger log = LoggerFactory.getLogger(Asynchronizer.class);

    private final CapabilityDescriptor descriptor;
    private final Operation operation;
    private final CompletionSink sink;
    private final AdapterProvider baseProvider;
    private final Executor executor;
    private final AsynchronizerConfig config;

    private final AtomicBoolean submitted = new AtomicBoolean(false);
    private final AtomicBoolean reported = new AtomicBoolean(false);
    private final AtomicInteger succeeded = new AtomicInteger();
    private final Map<OpId, Unit> units = new LinkedHashMap<>();
    private final UnitSink unitSink = new UnitSink();

    public Asynchronizer(CapabilityDescriptor descriptor, Operation operation, CompletionSink sink,
                         AdapterProvider baseProvider, Executor executor, AsynchronizerConfig config) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (baseProvider == null) {
            throw new IllegalArgumentException("baseProvider cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.descriptor = descriptor;
        this.operation = operation;
        this.sink = sink;
        this.baseProvider = baseProvider;
        this.executor = executor;
        this.config = config;

        for (Operation unit : operation.splitByGranule()) {
            units.put(unit.getOpId(), new Unit(unit));
        }
    }

    @Override
    public void submit() {
        if (!submitted.compareAndSet(false, true)) {
            throw new IllegalStateException("Operation " + operation.getOpId().getValue() + " was already submitted");
        }

        log.info("Splitting {} into {} units for {} (synchronous: {})", operation.getOpId().getValue(),
            units.size(), descriptor.name(), descriptor.capabilities().synchronousOnly());
        try {
            executor.execute(this::runUnits);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule units of {}", operation.getOpId().getValue(), e);
            report(Fail.of(Fail.SUBMISSION_FAILED,
                "Service " + descriptor.name() + " could not accept the request: " + e.getMessage(),
                e.getClass().getName()));
        }
    }

    @Override
    public OpId opId() {
        return operation.getOpId();
    }

    /**
     * 하위 단위 알림을 받는 sink.
     *
     * @return 이 Asynchronizer의 하위 단위 sink
     */
    public CompletionSink unitSink() {
        return unitSink;
    }

    /**
     * @return 입력 순서대로 정렬된 하위 Operation
     */
    public List<Operation> units() {
        return units.values().stream().map(unit -> unit.operation).toList();
    }

    private void runUnits() {
        boolean waitForEach = descriptor.capabilities().synchronousOnly();
        for (Unit unit : units.values()) {
            try {
                InvocationAdapter adapter = baseProvider.create(descriptor, unit.operation, unitSink);
                adapter.submit();
            } catch (RuntimeException e) {
                log.error("Could not submit unit {}", unit.operation.getOpId().getValue(), e);
                unitSink.complete(unit.operation, Fail.of(Fail.SUBMISSION_FAILED,
                    "Unit " + unit.operation.getOpId().getValue() + " could not be submitted: " + e.getMessage(),
                    e.getClass().getName()));
            }

            if (waitForEach && !awaitUnit(unit)) {
                return;
            }
        }
    }

    /**
     * @return 계속 진행해도 되면 true, 인터럽트되면 false
     */
    private boolean awaitUnit(Unit unit) {
        try {
            if (!unit.done.await(config.unitTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Unit {} did not complete within {}ms", unit.operation.getOpId().getValue(),
                    config.unitTimeoutMs());
                unitSink.complete(unit.operation, Fail.of(Fail.UNIT_TIMEOUT,
                    "Unit " + unit.operation.getOpId().getValue() + " did not complete within "
                        + config.unitTimeoutMs() + "ms"));
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            report(Fail.of(Fail.UNIT_FAILED,
                "Interrupted while waiting for unit " + unit.operation.getOpId().getValue()));
            return false;
        }
    }

    private void report(Outcome outcome) {
        if (!reported.compareAndSet(false, true)) {
            log.debug("Discarding outcome for {} after it was reported: {}", operation.getOpId().getValue(), outcome);
            return;
        }
        log.info("Reporting {} for {}", outcome.isOk() ? "success" : "failure", operation.getOpId().getValue());
        sink.complete(operation, outcome);
    }

    private static final class Unit {

        private final Operation operation;
        private final CountDownLatch done = new CountDownLatch(1);
        private final AtomicBoolean completed = new AtomicBoolean(false);

        private Unit(Operation operation) {
            this.operation = operation;
        }
    }

    private final class UnitSink implements CompletionSink {

        @Override
        public void complete(Operation unitOperation, Outcome outcome) {
            if (unitOperation == null || outcome == null) {
                throw new IllegalArgumentException("unitOperation and outcome cannot be null");
            }
            Unit unit = units.get(unitOperation.getOpId());
            if (unit == null) {
                log.warn("Ignoring completion for unknown unit {} of {}", unitOperation.getOpId().getValue(),
                    operation.getOpId().getValue());
                return;
            }
            if (!unit.completed.compareAndSet(false, true)) {
                log.warn("Dropping duplicate completion for unit {}", unitOperation.getOpId().getValue());
                return;
            }
            unit.done.countDown();

            if (outcome instanceof Fail fail) {
                report(Fail.of(Fail.UNIT_FAILED,
                    "Unit " + unitOperation.getOpId().getValue() + " failed: " + fail.message(),
                    fail.errorCode()));
            } else if (succeeded.incrementAndGet() == units.size()) {
                report(Ok.of(operation.getOpId(), "All " + units.size() + " units completed"));
            }
        }

        @Override
        public boolean isAwaiting(OpId opId) {
            Unit unit = units.get(opId);
            return unit != null && !unit.completed.get();
        }
    }
}
