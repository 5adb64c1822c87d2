package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.exception.SubmissionException;

/**
 * Message queue SPI for out-of-process operation pickup.
 *
 * <p>The queue adapter publishes the serialized operation and returns. A successful
 * publish is not a completion: a downstream consumer picks the message up and
 * notifies the operation's completion address later.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish may be called concurrently by many adapters</li>
 *   <li>Reject explicitly: a message that was not accepted must raise {@link SubmissionException},
 *       never be dropped silently</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface MessageChannel {

    /**
     * Publishes a message to the named channel.
     *
     * @param channel channel (queue) name from the service's parameters
     * @param message serialized operation
     * @throws SubmissionException if the channel rejected the message
     */
    void publish(String channel, String message) throws SubmissionException;
}
