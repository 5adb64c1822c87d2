package com.ryuqq.dispatcher.adapter.inmemory.channel;

import com.ryuqq.dispatcher.core.exception.SubmissionException;
import com.ryuqq.dispatcher.core.spi.MessageChannel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link MessageChannel} SPI for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Channels:</strong> ConcurrentHashMap&lt;String, ConcurrentLinkedQueue&lt;String&gt;&gt; - one FIFO queue per channel name, created on first publish</li>
 *   <li><strong>Rejection:</strong> a volatile flag that makes publish fail, to simulate an unavailable broker</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryMessageChannel channel = new InMemoryMessageChannel();
 * channel.publish("harmony-gdal", serializedOperation);
 *
 * // downstream consumer side
 * List&lt;String&gt; batch = channel.dequeue("harmony-gdal", 10);
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class InMemoryMessageChannel implements MessageChannel {

    private final ConcurrentHashMap<String, ConcurrentLinkedQueue<String>> channels = new ConcurrentHashMap<>();

    private volatile boolean rejecting;

    /**
     * {@inheritDoc}
     *
     * @throws SubmissionException if rejection is switched on
     */
    @Override
    public void publish(String channel, String message) throws SubmissionException {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (rejecting) {
            throw new SubmissionException("Channel " + channel + " rejected the message");
        }

        channels.computeIfAbsent(channel, name -> new ConcurrentLinkedQueue<>()).add(message);
    }

    /**
     * Removes up to {@code batchSize} messages from the head of a channel.
     *
     * @param channel channel name
     * @param batchSize maximum number of messages
     * @return messages in publish order, empty if none
     * @throws IllegalArgumentException if batchSize is not positive
     */
    public List<String> dequeue(String channel, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<String> result = new ArrayList<>();
        ConcurrentLinkedQueue<String> queue = channels.get(channel);
        if (queue == null) {
            return result;
        }
        for (int i = 0; i < batchSize; i++) {
            String message = queue.poll();
            if (message == null) {
                break;
            }
            result.add(message);
        }
        return result;
    }

    /**
     * Switches simulated broker rejection on or off.
     *
     * @param rejecting true to make every publish fail
     */
    public void setRejecting(boolean rejecting) {
        this.rejecting = rejecting;
    }

    /**
     * Returns the number of queued messages on a channel. Used for test assertions.
     *
     * @param channel channel name
     * @return queue size
     */
    public int size(String channel) {
        ConcurrentLinkedQueue<String> queue = channels.get(channel);
        return queue == null ? 0 : queue.size();
    }

    /**
     * Clears all channels and resets rejection. Used for test cleanup.
     */
    public void clear() {
        channels.clear();
        rejecting = false;
    }
}
