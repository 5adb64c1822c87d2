package com.ryuqq.dispatcher.adapter.inmemory.sink;

import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import com.ryuqq.dispatcher.core.spi.CompletionSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link CompletionSink} for testing and reference purposes.
 *
 * <p>Every notification is recorded, including duplicates, so tests can assert that an
 * operation received exactly one. Waiting for a notification is latch based, not polled.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCompletionSink sink = new InMemoryCompletionSink();
 * dispatcher.dispatch(operation, context);
 *
 * assertThat(sink.awaitCompletion(operation.getOpId(), 1000)).isTrue();
 * assertThat(sink.notificationsFor(operation.getOpId())).hasSize(1);
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class InMemoryCompletionSink implements CompletionSink {

    private final ConcurrentHashMap<OpId, List<Notification>> notifications = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<OpId, CountDownLatch> latches = new ConcurrentHashMap<>();

    @Override
    public void complete(Operation operation, Outcome outcome) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }

        OpId opId = operation.getOpId();
        notifications.computeIfAbsent(opId, id -> new CopyOnWriteArrayList<>())
            .add(new Notification(opId, operation.getCallback(), outcome, System.currentTimeMillis()));
        latchFor(opId).countDown();
    }

    /**
     * {@inheritDoc}
     *
     * <p>True until the first notification for the operation is recorded.</p>
     */
    @Override
    public boolean isAwaiting(OpId opId) {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        List<Notification> received = notifications.get(opId);
        return received == null || received.isEmpty();
    }

    /**
     * Blocks until the operation has received at least one notification.
     *
     * @param opId operation to wait for
     * @param timeoutMs maximum wait in milliseconds
     * @return true if a notification arrived within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCompletion(OpId opId, long timeoutMs) throws InterruptedException {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        return latchFor(opId).await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Returns every notification recorded for the operation, in arrival order.
     *
     * @param opId operation id
     * @return snapshot of notifications, empty if none
     */
    public List<Notification> notificationsFor(OpId opId) {
        List<Notification> received = notifications.get(opId);
        return received == null ? List.of() : new ArrayList<>(received);
    }

    /**
     * Returns the first outcome recorded for the operation.
     *
     * @param opId operation id
     * @return the outcome, or null if none arrived yet
     */
    public Outcome firstOutcome(OpId opId) {
        List<Notification> received = notificationsFor(opId);
        return received.isEmpty() ? null : received.get(0).outcome();
    }

    /**
     * Returns the number of notifications across all operations. Used for test assertions.
     *
     * @return total count
     */
    public int totalNotifications() {
        return notifications.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Clears all recorded notifications. Used for test cleanup.
     */
    public void clear() {
        notifications.clear();
        latches.clear();
    }

    private CountDownLatch latchFor(OpId opId) {
        return latches.computeIfAbsent(opId, id -> new CountDownLatch(1));
    }

    /**
     * One recorded Completion Notification.
     *
     * @param opId operation that completed
     * @param callback completion address the notification was delivered to
     * @param outcome terminal outcome
     * @param receivedAt epoch millis when recorded
     */
    public record Notification(OpId opId, String callback, Outcome outcome, long receivedAt) {
    }
}
