/**
 * Completion Notification outcome types.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.outcome.Ok} - The backend finished, or the fallback explained why none could run</li>
 *   <li>{@link com.ryuqq.dispatcher.core.outcome.Fail} - Terminal failure with a machine-readable error code</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (outcome instanceof Fail fail) {
 *     log.warn("{} failed: {}", opId, fail.errorCode());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.outcome;
