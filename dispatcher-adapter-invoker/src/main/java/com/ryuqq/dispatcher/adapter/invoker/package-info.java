/**
 * Invocation adapters and their wiring.
 *
 * <h2>Adapters</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.adapter.invoker.HttpInvocationAdapter} - direct call</li>
 *   <li>{@link com.ryuqq.dispatcher.adapter.invoker.LocalProcessInvocationAdapter} - locally spawned container</li>
 *   <li>{@link com.ryuqq.dispatcher.adapter.invoker.WorkflowInvocationAdapter} - workflow engine submission</li>
 *   <li>{@link com.ryuqq.dispatcher.adapter.invoker.QueueInvocationAdapter} - message queue publish</li>
 *   <li>{@link com.ryuqq.dispatcher.adapter.invoker.NoOpInvocationAdapter} - download-links-only fallback</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.dispatcher.adapter.invoker.Asynchronizer} decorates any of them for single-unit or
 * synchronous-only services. {@link com.ryuqq.dispatcher.adapter.invoker.CompletionGuard} keeps the
 * one-notification-per-operation rule at the caller boundary. {@link com.ryuqq.dispatcher.adapter.invoker.CompletionRouter}
 * receives notifications sent to completion addresses and hands unit ids to the owning Asynchronizer.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.invoker;
