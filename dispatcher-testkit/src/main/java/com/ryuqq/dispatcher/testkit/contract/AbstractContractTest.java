package com.ryuqq.dispatcher.testkit.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.dispatcher.adapter.inmemory.channel.InMemoryMessageChannel;
import com.ryuqq.dispatcher.adapter.inmemory.sink.InMemoryCompletionSink;
import com.ryuqq.dispatcher.adapter.inmemory.workflow.InMemoryWorkflowEngine;
import com.ryuqq.dispatcher.adapter.invoker.DefaultServiceFactory;
import com.ryuqq.dispatcher.core.model.Granule;
import com.ryuqq.dispatcher.core.model.OpId;
import com.ryuqq.dispatcher.core.model.Operation;
import com.ryuqq.dispatcher.core.model.Source;
import com.ryuqq.dispatcher.core.outcome.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Provides fresh in-memory SPI implementations per test, operation builders and
 * assertions on the Completion Notifications recorded by the sink.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryCompletionSink: records every notification per operation</li>
 *   <li>InMemoryMessageChannel: queue mechanism hand-off</li>
 *   <li>InMemoryWorkflowEngine: workflow mechanism hand-off</li>
 *   <li>executor: worker pool shared by the factory and the Asynchronizer</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         Operation operation = createOperation("C1", 3);
 *         DefaultServiceFactory factory = createFactory().build();
 *         // ... dispatch, play the backend ...
 *         assertSingleNotification(operation.getOpId());
 *     }
 * }
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final String CALLBACK = "http://localhost:3000/service";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    protected InMemoryCompletionSink sink;
    protected InMemoryMessageChannel channel;
    protected InMemoryWorkflowEngine workflowEngine;
    protected ExecutorService executor;

    @BeforeEach
    void setUp() {
        sink = new InMemoryCompletionSink();
        channel = new InMemoryMessageChannel();
        workflowEngine = new InMemoryWorkflowEngine();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
        if (sink != null) {
            sink.clear();
        }
        if (channel != null) {
            channel.clear();
        }
        if (workflowEngine != null) {
            workflowEngine.clear();
        }
    }

    /**
     * Creates an operation on one collection with the given number of granules.
     *
     * @param collection collection id
     * @param granuleCount number of granules ({@code G1..Gn})
     * @return a new operation with a random id
     */
    protected Operation createOperation(String collection, int granuleCount) {
        return createOperation(collection, List.of(), granuleCount);
    }

    /**
     * Creates an operation that asks for variable subsetting.
     *
     * @param collection collection id
     * @param variables requested variables
     * @param granuleCount number of granules
     * @return a new operation with a random id
     */
    protected Operation createOperation(String collection, List<String> variables, int granuleCount) {
        List<Granule> granules = new ArrayList<>();
        for (int i = 1; i <= granuleCount; i++) {
            granules.add(Granule.of("G" + i, "granule-" + i + ".nc", "s3://bucket/" + collection + "/granule-" + i + ".nc"));
        }
        OpId opId = OpId.random();
        return Operation.builder(opId, CALLBACK + "/" + opId.getValue() + "/response")
            .source(Source.of(collection, variables, granules))
            .build();
    }

    /**
     * Returns a factory builder wired to this test's executor, channel and workflow engine.
     *
     * @return builder ready for further registration
     */
    protected DefaultServiceFactory.Builder createFactory() {
        return DefaultServiceFactory.builder()
            .executor(executor)
            .queue(channel)
            .workflow(workflowEngine);
    }

    /**
     * Reads an operation the way a backend receives it (queue message, process argument).
     *
     * <p>The result carries the request id and the completion address the backend must report to.</p>
     *
     * @param message serialized operation
     * @return operation rebuilt from the message
     */
    protected Operation receivedOperation(String message) {
        try {
            JsonNode root = MAPPER.readTree(message);
            return Operation.builder(OpId.of(root.get("requestId").asText()), root.get("callback").asText())
                .source(Source.of(root.get("sources").get(0).get("collection").asText()))
                .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable operation message: " + message, e);
        }
    }

    /**
     * Returns the serialized operation handed to a child process.
     *
     * @param command launched command
     * @return the value after {@code --harmony-input}
     */
    protected String harmonyInput(List<String> command) {
        int index = command.indexOf("--harmony-input");
        assertTrue(index >= 0 && index + 1 < command.size(), "No --harmony-input in " + command);
        return command.get(index + 1);
    }

    /**
     * Asserts that exactly one notification was delivered for the operation.
     *
     * @param opId operation id
     * @return the delivered outcome
     */
    protected Outcome assertSingleNotification(OpId opId) {
        List<InMemoryCompletionSink.Notification> received = sink.notificationsFor(opId);
        assertEquals(1, received.size(),
            String.format("Expected exactly one notification for %s but got %s", opId, received));
        return received.get(0).outcome();
    }

    /**
     * Asserts that no notification was delivered for the operation.
     *
     * @param opId operation id
     */
    protected void assertNoNotification(OpId opId) {
        assertTrue(sink.notificationsFor(opId).isEmpty(),
            String.format("Expected no notification for %s but got %s", opId, sink.notificationsFor(opId)));
    }

    /**
     * Waits until the condition holds.
     *
     * @param condition condition to poll
     * @param timeoutMs maximum wait
     */
    protected void awaitCondition(BooleanSupplier condition, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + timeoutMs + "ms");
            }
            sleep(10);
        }
    }

    /**
     * Shuts the executor down and waits for every queued task to finish.
     */
    protected void awaitExecutorIdle() {
        executor.shutdown();
        try {
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not drain in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for executor", e);
        }
    }

    /**
     * Sleeps for the specified duration.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
