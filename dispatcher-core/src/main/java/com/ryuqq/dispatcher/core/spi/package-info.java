/**
 * Service Provider Interfaces for the collaborators outside the dispatcher core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.CompletionSink} - receives exactly one Completion Notification per operation</li>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.MessageChannel} - queue publish transport</li>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.WorkflowEngine} - external orchestration engine</li>
 * </ul>
 *
 * <p>Reference implementations live in the {@code dispatcher-adapter-inmemory} module.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.spi;
