package com.ryuqq.dispatcher.testkit.contract;

import com.ryuqq.dispatcher.adapter.invoker.Asynchronizer;
import com.ryuqq.dispatcher.adapter.invoker.CompletionGuard;
import com.ryuqq.dispatcher.adapter.invoker.DefaultDispatcher;
import com.ryuqq.dispatcher.application.selection.ServiceSelector;
import com.ryuqq.dispatcher.core.descriptor.Capabilities;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptor;
import com.ryuqq.dispatcher.core.descriptor.CapabilityDescriptorStore;
import com.ryuqq.dispatcher.core.descriptor.Mechanism;
import com.ryuqq.dispatcher.core.invoker.InvocationAdapter;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.RequestContext;
import com.ryuqq.dispatcher.core.outcome.Fail;
import com.ryuqq.dispatcher.core.outcome.Ok;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test for Asynchronizer aggregation.
 *
 * <p>A single-unit queue service receives three units; the test plays the backend and
 * reports unit 2 as failed. Whatever order the units report in, the caller receives exactly
 * one failure notification.</p>
 *
 * <p>The dispatcher scenarios play a queue consumer: it reads each published unit and reports to the
 * completion address carried in the message, through {@link DefaultDispatcher#completionSink()}.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class AsynchronizerContractTest extends AbstractContractTest {

    private static final String CHANNEL = "harmony-gdal";

    private static Stream<List<Integer>> completionOrders() {
        return Stream.of(
            List.of(1, 2, 3),
            List.of(1, 3, 2),
            List.of(2, 1, 3),
            List.of(2, 3, 1),
            List.of(3, 1, 2),
            List.of(3, 2, 1));
    }

    @ParameterizedTest
    @MethodSource("completionOrders")
    void testAsynchronizer_SecondUnitFails_ExactlyOneFailure(List<Integer> order) {
        // Given: a single-unit service and an operation with three granules
        CapabilityDescriptor descriptor = CapabilityDescriptor.of("gdal", Mechanism.QUEUE, List.of("C1"),
            new Capabilities(List.of(), false, false, true, false), Map.of("channel", CHANNEL));
        Operation operation = createOperation("C1", 3);

        CompletionGuard guard = new CompletionGuard(sink);
        guard.register(operation.getOpId());
        InvocationAdapter adapter = createFactory().build().build(descriptor, operation, guard);
        Asynchronizer asynchronizer = assertInstanceOf(Asynchronizer.class, adapter);

        guard.markSubmitted(operation.getOpId());
        asynchronizer.submit();
        awaitCondition(() -> channel.size(CHANNEL) == 3, 5000);

        // When: the backend reports each unit, unit 2 failing, in the given order
        List<Operation> units = asynchronizer.units();
        for (int index : order) {
            Operation unit = units.get(index - 1);
            Outcome outcome = index == 2
                ? Fail.of("BACKEND_ERROR", "granule could not be read")
                : Ok.of(unit.getOpId());
            asynchronizer.unitSink().complete(unit, outcome);
        }
        // and redelivers two reports
        asynchronizer.unitSink().complete(units.get(1), Fail.of("BACKEND_ERROR", "again"));
        asynchronizer.unitSink().complete(units.get(0), Ok.of(units.get(0).getOpId()));

        // Then: exactly one failure reached the caller
        Fail fail = assertInstanceOf(Fail.class, assertSingleNotification(operation.getOpId()));
        assertEquals(Fail.UNIT_FAILED, fail.errorCode());
        assertEquals("BACKEND_ERROR", fail.cause());
        assertEquals(1, sink.totalNotifications());
    }

    private DefaultDispatcher queueDispatcher() {
        CapabilityDescriptor descriptor = CapabilityDescriptor.of("gdal", Mechanism.QUEUE, List.of("C1"),
            new Capabilities(List.of(), false, false, true, false), Map.of("channel", CHANNEL));
        return new DefaultDispatcher(
            new ServiceSelector(CapabilityDescriptorStore.of(List.of(descriptor))),
            createFactory().build(),
            sink);
    }

    private List<Operation> consumeUnits(int count) {
        awaitCondition(() -> channel.size(CHANNEL) == count, 5000);
        return channel.dequeue(CHANNEL, count).stream().map(this::receivedOperation).toList();
    }

    @ParameterizedTest
    @MethodSource("completionOrders")
    void testDispatch_ConsumerReportsUnitsSecondFails_ExactlyOneFailure(List<Integer> order) {
        // Given: a dispatched three-granule operation and a consumer holding its units
        DefaultDispatcher dispatcher = queueDispatcher();
        Operation operation = createOperation("C1", 3);
        dispatcher.dispatch(operation, RequestContext.empty());
        List<Operation> received = consumeUnits(3);

        // When: the consumer reports each unit to its own address, unit 2 failing
        for (int index : order) {
            Operation unit = received.get(index - 1);
            assertEquals(operation.getOpId().getValue() + "." + index, unit.getOpId().getValue());
            Outcome outcome = index == 2
                ? Fail.of("BACKEND_ERROR", "granule could not be read")
                : Ok.of(unit.getOpId());
            dispatcher.completionSink().complete(unit, outcome);
        }
        // and redelivers one report
        dispatcher.completionSink().complete(received.get(1), Fail.of("BACKEND_ERROR", "again"));

        // Then: exactly one failure reached the caller
        Fail fail = assertInstanceOf(Fail.class, assertSingleNotification(operation.getOpId()));
        assertEquals(Fail.UNIT_FAILED, fail.errorCode());
        assertEquals("BACKEND_ERROR", fail.cause());
        assertEquals(1, sink.totalNotifications());
        assertEquals(0, dispatcher.completionSink().inFlight());
    }

    @Test
    void testDispatch_ConsumerReportsAllUnitsOk_ExactlyOneOk() {
        // Given
        DefaultDispatcher dispatcher = queueDispatcher();
        Operation operation = createOperation("C1", 3);
        dispatcher.dispatch(operation, RequestContext.empty());
        List<Operation> received = consumeUnits(3);

        // When: every unit succeeds, the last one twice
        received.forEach(unit -> dispatcher.completionSink().complete(unit, Ok.of(unit.getOpId())));
        dispatcher.completionSink().complete(received.get(2), Ok.of(received.get(2).getOpId()));

        // Then
        Ok ok = assertInstanceOf(Ok.class, assertSingleNotification(operation.getOpId()));
        assertEquals("All 3 units completed", ok.message());
        assertEquals(1, sink.totalNotifications());
        assertTrue(received.stream().allMatch(unit -> unit.getCallback().contains("/units/")));
    }
}
